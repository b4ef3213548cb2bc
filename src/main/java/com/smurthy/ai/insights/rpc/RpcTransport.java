package com.smurthy.ai.insights.rpc;

import java.io.IOException;

/**
 * Sends one request and returns the whole response body. Non-2xx responses are returned, not thrown.
 */
@FunctionalInterface
public interface RpcTransport {

    /**
     * @throws IOException on connection failure or when {@link RpcHttpRequest#timeout()} elapses
     */
    RpcHttpResponse execute(RpcHttpRequest request) throws IOException;
}
