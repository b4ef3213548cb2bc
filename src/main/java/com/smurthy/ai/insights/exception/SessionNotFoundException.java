package com.smurthy.ai.insights.exception;

/**
 * No readable cookie store, or no cookies for the Google domain in it.
 */
public class SessionNotFoundException extends InsightsException {

    public SessionNotFoundException(String message) {
        super(ErrorKind.SESSION_NOT_FOUND, message);
    }

    public SessionNotFoundException(String message, Throwable cause) {
        super(ErrorKind.SESSION_NOT_FOUND, message, cause);
    }
}
