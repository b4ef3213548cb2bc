package com.smurthy.ai.insights.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * Builds batchexecute response bodies for tests.
 */
public final class RpcFixtures {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RpcFixtures() {
    }

    /**
     * Guard line followed by one correctly length-prefixed frame per payload.
     */
    public static byte[] framedBody(String... payloads) {
        StringBuilder body = new StringBuilder(")]}'\n");
        for (String payload : payloads) {
            String chunk = payload + "\n";
            body.append('\n').append(chunk.getBytes(StandardCharsets.UTF_8).length).append('\n').append(chunk);
        }
        return body.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * A {@code [["wrb.fr", procedureId, innerJson, null, null, null, "generic"]]} frame payload.
     */
    public static String dataFrame(String procedureId, Object inner) {
        try {
            String innerJson = MAPPER.writeValueAsString(inner);
            List<Object> entry = Arrays.asList("wrb.fr", procedureId, innerJson, null, null, null, "generic");
            return MAPPER.writeValueAsString(List.of(entry));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    public static String bookkeepingFrame() {
        return "[[\"di\",87],[\"af.httprm\",86,\"-5312345678901234567\",12]]";
    }

    public static RpcHttpResponse ok(byte[] body) {
        return new RpcHttpResponse(200, body);
    }

    public static RpcHttpResponse antiForgeryRejection(String newToken) {
        String body = ")]}'\n\n[[\"er\",null,null,null,null,400,null,null,null,3],[\"xsrf\",\"" + newToken + "\",null]]";
        return new RpcHttpResponse(400, body.getBytes(StandardCharsets.UTF_8));
    }
}
