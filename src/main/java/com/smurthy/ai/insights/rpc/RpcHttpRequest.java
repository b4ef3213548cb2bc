package com.smurthy.ai.insights.rpc;

import java.time.Duration;
import java.util.Map;

/**
 * A fully assembled form POST, independent of the HTTP client used to send it.
 */
public record RpcHttpRequest(String url, Map<String, String> headers, Map<String, String> form, Duration timeout) {

    public RpcHttpRequest {
        headers = Map.copyOf(headers);
        form = Map.copyOf(form);
    }
}
