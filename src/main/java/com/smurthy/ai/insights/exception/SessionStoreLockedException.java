package com.smurthy.ai.insights.exception;

public class SessionStoreLockedException extends InsightsException {

    public SessionStoreLockedException(String message, Throwable cause) {
        super(ErrorKind.SESSION_STORE_LOCKED, message, cause);
    }
}
