package com.smurthy.ai.insights.rpc;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.smurthy.ai.insights.exception.RpcDecodeException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a batchexecute response body into frames.
 *
 * Layout: an optional {@code )]}'} guard line, then repeated {@code <decimal byte count>\n<payload>},
 * where the payload is exactly that many bytes of one JSON array. Whitespace between frames is ignored.
 */
@Component
public class RpcFrameReader {

    static final String XSSI_GUARD = ")]}'";

    private final ObjectMapper objectMapper;

    public RpcFrameReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<RpcFrame> read(byte[] body) {
        if (body == null || body.length == 0) {
            throw new RpcDecodeException("Empty response body");
        }

        int pos = skipGuard(body);
        List<RpcFrame> frames = new ArrayList<>();
        while (true) {
            pos = skipWhitespace(body, pos);
            if (pos >= body.length) {
                break;
            }

            int lineEnd = indexOf(body, (byte) '\n', pos);
            if (lineEnd < 0) {
                throw new RpcDecodeException("Frame length line at offset " + pos + " is not terminated");
            }
            int byteCount = parseLength(body, pos, lineEnd);
            int payloadStart = lineEnd + 1;
            if (payloadStart + (long) byteCount > body.length) {
                throw new RpcDecodeException("Stream ended inside a frame: expected " + byteCount + " bytes at offset "
                        + payloadStart + ", only " + (body.length - payloadStart) + " available");
            }

            frames.add(new RpcFrame(byteCount, parsePayload(body, payloadStart, byteCount)));
            pos = payloadStart + byteCount;
        }

        if (frames.isEmpty()) {
            throw new RpcDecodeException("Response contained no frames");
        }
        return frames;
    }

    /**
     * Reads the frames and concatenates their entries.
     */
    public DecodedEnvelope readEnvelope(byte[] body) {
        List<JsonNode> entries = new ArrayList<>();
        for (RpcFrame frame : read(body)) {
            frame.payload().forEach(entries::add);
        }
        return new DecodedEnvelope(entries);
    }

    private static int skipGuard(byte[] body) {
        byte[] guard = XSSI_GUARD.getBytes(StandardCharsets.US_ASCII);
        if (body.length < guard.length) {
            return 0;
        }
        for (int i = 0; i < guard.length; i++) {
            if (body[i] != guard[i]) {
                return 0;
            }
        }
        return guard.length;
    }

    private static int skipWhitespace(byte[] body, int pos) {
        while (pos < body.length && Character.isWhitespace(body[pos])) {
            pos++;
        }
        return pos;
    }

    private static int indexOf(byte[] body, byte target, int from) {
        for (int i = from; i < body.length; i++) {
            if (body[i] == target) {
                return i;
            }
        }
        return -1;
    }

    private static int parseLength(byte[] body, int start, int end) {
        String line = new String(body, start, end - start, StandardCharsets.US_ASCII).trim();
        if (line.isEmpty() || !line.chars().allMatch(Character::isDigit)) {
            throw new RpcDecodeException("Expected a decimal frame length but found '" + abbreviate(line) + "'");
        }
        try {
            return Integer.parseInt(line);
        } catch (NumberFormatException e) {
            throw new RpcDecodeException("Frame length '" + abbreviate(line) + "' is out of range", e);
        }
    }

    private ArrayNode parsePayload(byte[] body, int offset, int length) {
        try (JsonParser parser = objectMapper.getFactory().createParser(body, offset, length)) {
            JsonNode node = objectMapper.readTree(parser);
            if (node == null || !node.isArray()) {
                throw new RpcDecodeException("Frame payload at offset " + offset + " is not a JSON array");
            }
            // the declared length must end exactly where the array ends (trailing whitespace aside)
            if (parser.nextToken() != null) {
                throw new RpcDecodeException("Frame payload at offset " + offset + " has data after its JSON array");
            }
            return (ArrayNode) node;
        } catch (JsonProcessingException e) {
            throw new RpcDecodeException("Frame payload at offset " + offset + " is not a complete JSON array: "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new RpcDecodeException("Could not read frame payload at offset " + offset, e);
        }
    }

    private static String abbreviate(String s) {
        return s.length() > 40 ? s.substring(0, 40) + "..." : s;
    }
}
