package com.smurthy.ai.insights.exception;

import java.util.List;

/**
 * The cookie store has Google cookies, but not every required session cookie.
 */
public class IncompleteSessionException extends InsightsException {

    private final List<String> missingCookies;

    public IncompleteSessionException(String message, List<String> missingCookies) {
        super(ErrorKind.INCOMPLETE_SESSION, message);
        this.missingCookies = List.copyOf(missingCookies);
    }

    public List<String> getMissingCookies() {
        return missingCookies;
    }
}
