package com.smurthy.ai.insights.exception;

/**
 * Network failure, timeout, or a non-2xx status that is not authentication related.
 */
public class RpcTransportException extends InsightsException {

    public RpcTransportException(String message) {
        super(ErrorKind.RPC_TRANSPORT_ERROR, message);
    }

    public RpcTransportException(String message, String remediation) {
        super(ErrorKind.RPC_TRANSPORT_ERROR, message, remediation, null);
    }

    public RpcTransportException(String message, Throwable cause) {
        super(ErrorKind.RPC_TRANSPORT_ERROR, message, cause);
    }
}
