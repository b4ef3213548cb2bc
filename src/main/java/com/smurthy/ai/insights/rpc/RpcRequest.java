package com.smurthy.ai.insights.rpc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One procedure invocation. Arguments are positional and may contain nulls.
 */
public record RpcRequest(String procedureId, List<Object> args) {

    public RpcRequest {
        if (procedureId == null || procedureId.isBlank()) {
            throw new IllegalArgumentException("procedureId is required");
        }
        args = Collections.unmodifiableList(new ArrayList<>(args == null ? List.of() : args));
    }
}
