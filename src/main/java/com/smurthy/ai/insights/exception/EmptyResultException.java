package com.smurthy.ai.insights.exception;

/**
 * The response decoded cleanly but contained zero rows.
 */
public class EmptyResultException extends InsightsException {

    public EmptyResultException(String message) {
        super(ErrorKind.EMPTY_RESULT, message);
    }
}
