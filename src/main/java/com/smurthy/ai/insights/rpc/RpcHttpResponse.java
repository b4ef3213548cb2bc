package com.smurthy.ai.insights.rpc;

import java.nio.charset.StandardCharsets;

public record RpcHttpResponse(int statusCode, byte[] body) {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String bodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }
}
