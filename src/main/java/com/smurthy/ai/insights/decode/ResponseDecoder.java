package com.smurthy.ai.insights.decode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.insights.exception.RpcDecodeException;
import com.smurthy.ai.insights.extract.ProcedureLayout;
import com.smurthy.ai.insights.rpc.DecodedEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns the data entry of a response into row arrays.
 *
 * The inner payload of a {@code wrb.fr} entry is itself a JSON document encoded as a string.
 * Its rows are located with the procedure's row-list path, trying shapes A, B and C in that order.
 */
@Component
public class ResponseDecoder {

    private static final Logger log = LoggerFactory.getLogger(ResponseDecoder.class);

    static final int MAX_UNWRAP_DEPTH = 2;

    private final ObjectMapper objectMapper;

    public ResponseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DecodeResult decode(DecodedEnvelope envelope, ProcedureLayout layout) {
        JsonNode entry = envelope.dataEntry(layout.rpcId()).orElseThrow(() -> new RpcDecodeException(
                "Response has no data entry for " + layout.procedure() + " (" + layout.rpcId() + ")"));

        JsonNode payload = parseInner(entry.path(2), layout);
        if (payload == null || payload.isNull()) {
            log.debug("{} returned a null payload", layout.procedure());
            return DecodeResult.empty();
        }
        if (hasNullContainer(payload, layout.rowListPath())) {
            log.debug("{} returned a null row list", layout.procedure());
            return DecodeResult.empty();
        }

        List<ShapeMatch> attempts = new ArrayList<>();
        for (RowShape shape : RowShape.values()) {
            ShapeMatch match = attempt(shape, payload, layout);
            if (match.matched()) {
                if (match.skippedRows() > 0) {
                    log.warn("{}: skipped {} malformed rows (shape {})", layout.procedure(), match.skippedRows(), shape);
                }
                log.debug("{} decoded with shape {}: {} rows", layout.procedure(), shape, match.rows().size());
                return new DecodeResult(match.rows(), shape, match.skippedRows());
            }
            attempts.add(match);
        }

        String reasons = attempts.stream()
                .map(m -> m.shape() + ": " + m.mismatchReason())
                .collect(Collectors.joining("; "));
        throw new RpcDecodeException("No known row shape matched " + layout.procedure() + " response. " + reasons);
    }

    ShapeMatch attempt(RowShape shape, JsonNode payload, ProcedureLayout layout) {
        return switch (shape) {
            case A -> matchFlat(shape, navigate(payload, layout.rowListPath()), layout.rowLayout());
            case B -> matchWrapped(navigate(payload, layout.rowListPath()), layout.rowLayout());
            case C -> {
                List<Integer> path = layout.rowListPath();
                yield matchFlat(shape, navigate(payload, path.subList(0, path.size() - 1)), layout.rowLayout());
            }
        };
    }

    private static ShapeMatch matchFlat(RowShape shape, JsonNode container, RowLayout rowLayout) {
        if (container == null || !container.isArray()) {
            return ShapeMatch.mismatch(shape, "no row list at the expected depth");
        }
        List<RawRow> rows = new ArrayList<>();
        int skipped = 0;
        for (JsonNode element : container) {
            if (rowLayout.fits(element)) {
                rows.add(new RawRow(element));
            } else {
                skipped++;
            }
        }
        if (rows.isEmpty() && skipped > 0) {
            return ShapeMatch.mismatch(shape, "none of " + skipped + " elements is a " + rowLayout);
        }
        return ShapeMatch.matched(shape, rows, skipped);
    }

    private static ShapeMatch matchWrapped(JsonNode container, RowLayout rowLayout) {
        if (container == null || !container.isArray()) {
            return ShapeMatch.mismatch(RowShape.B, "no row list at the expected depth");
        }
        List<RawRow> rows = new ArrayList<>();
        int skipped = 0;
        boolean unwrapped = false;
        for (JsonNode element : container) {
            JsonNode row = element;
            int depth = 0;
            while (depth < MAX_UNWRAP_DEPTH && !rowLayout.fits(row) && isSingletonWrapper(row)) {
                row = row.get(0);
                depth++;
            }
            if (rowLayout.fits(row)) {
                rows.add(new RawRow(row));
                unwrapped |= depth > 0;
            } else {
                skipped++;
            }
        }
        if (!unwrapped) {
            return ShapeMatch.mismatch(RowShape.B, "no element is a " + rowLayout + " inside single-element wrappers");
        }
        return ShapeMatch.matched(RowShape.B, rows, skipped);
    }

    private static boolean isSingletonWrapper(JsonNode node) {
        return node.isArray() && node.size() == 1 && node.get(0).isArray();
    }

    private JsonNode parseInner(JsonNode inner, ProcedureLayout layout) {
        if (inner.isMissingNode() || inner.isNull()) {
            return null;
        }
        if (!inner.isTextual()) {
            throw new RpcDecodeException(layout.procedure() + " data entry does not hold a JSON string payload");
        }
        try {
            return objectMapper.readTree(inner.asText());
        } catch (JsonProcessingException e) {
            throw new RpcDecodeException(layout.procedure() + " inner payload is not valid JSON: "
                    + e.getOriginalMessage(), e);
        }
    }

    /**
     * @return the node at {@code path}, or null if the path leaves the tree
     */
    static JsonNode navigate(JsonNode root, List<Integer> path) {
        JsonNode node = root;
        for (int index : path) {
            if (node == null || !node.isArray() || index >= node.size()) {
                return null;
            }
            node = node.get(index);
        }
        return node;
    }

    /**
     * Search Console answers "no data" with an explicit null somewhere along the row-list path.
     */
    private static boolean hasNullContainer(JsonNode root, List<Integer> path) {
        JsonNode node = root;
        for (int index : path) {
            if (node == null || !node.isArray() || index >= node.size()) {
                return false;
            }
            node = node.get(index);
            if (node.isNull()) {
                return true;
            }
        }
        return false;
    }
}
