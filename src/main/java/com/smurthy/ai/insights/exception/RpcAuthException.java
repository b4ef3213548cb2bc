package com.smurthy.ai.insights.exception;

public class RpcAuthException extends InsightsException {

    private final int statusCode;

    public RpcAuthException(String message, int statusCode) {
        super(ErrorKind.RPC_AUTH_ERROR, message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
