package com.smurthy.ai.insights.exception;

/**
 * Error taxonomy surfaced to tool callers.
 * Each kind carries a default remediation hint the agent can relay to the user.
 */
public enum ErrorKind {

    SESSION_NOT_FOUND(
            "Log in to Google in your browser (Chrome, Chromium, Brave, Edge or Firefox), "
                    + "then call refresh_google_session and retry."),
    INCOMPLETE_SESSION(
            "Your Google login looks partial. Sign out and back in to Google in the browser, "
                    + "then call refresh_google_session."),
    SESSION_STORE_LOCKED(
            "The browser's cookie store appears locked. Close the browser completely and retry, "
                    + "then call refresh_google_session."),
    ANTI_FORGERY_FETCH_FAILED(
            "Search Console did not hand out an anti-forgery token. Open search.google.com/search-console "
                    + "in the browser once, then call refresh_google_session."),
    RPC_TRANSPORT_ERROR(
            "Search Console could not be reached. Check your network connection and retry in a moment."),
    RPC_AUTH_ERROR(
            "Search Console rejected the session. Log in to Google in the browser, make sure the account "
                    + "has access to this property, then call refresh_google_session."),
    RPC_DECODE_ERROR(
            "Search Console answered in an unexpected format. The position table may need updating "
                    + "for a new upstream layout."),
    EMPTY_RESULT(
            "No data for this request. Search Console data lags about 3 days; "
                    + "try a date range ending 3 or more days ago."),
    INVALID_ARGUMENT(
            "Check the tool arguments (dates as YYYY-MM-DD, known dimension names) and retry."),
    INTERNAL_ERROR(
            "Unexpected failure. Check the server log on stderr for details.");

    private final String defaultRemediation;

    ErrorKind(String defaultRemediation) {
        this.defaultRemediation = defaultRemediation;
    }

    public String defaultRemediation() {
        return defaultRemediation;
    }
}
