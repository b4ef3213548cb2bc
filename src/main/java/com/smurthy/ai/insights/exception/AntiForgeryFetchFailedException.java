package com.smurthy.ai.insights.exception;

/**
 * The probe response did not contain the anti-forgery token pattern.
 */
public class AntiForgeryFetchFailedException extends InsightsException {

    public AntiForgeryFetchFailedException(String message) {
        super(ErrorKind.ANTI_FORGERY_FETCH_FAILED, message);
    }
}
