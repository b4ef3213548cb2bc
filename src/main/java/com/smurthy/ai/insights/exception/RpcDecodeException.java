package com.smurthy.ai.insights.exception;

/**
 * The response framing or payload shape could not be interpreted.
 */
public class RpcDecodeException extends InsightsException {

    public RpcDecodeException(String message) {
        super(ErrorKind.RPC_DECODE_ERROR, message);
    }

    public RpcDecodeException(String message, Throwable cause) {
        super(ErrorKind.RPC_DECODE_ERROR, message, cause);
    }
}
