package com.smurthy.ai.insights.exception;

/**
 * Base class for every typed failure of the Search Console client.
 *
 * The message describes what went wrong; {@link #remediation()} tells the user what to do about it.
 */
public abstract class InsightsException extends RuntimeException {

    private final ErrorKind kind;
    private final String remediation;

    protected InsightsException(ErrorKind kind, String message) {
        this(kind, message, kind.defaultRemediation(), null);
    }

    protected InsightsException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, kind.defaultRemediation(), cause);
    }

    protected InsightsException(ErrorKind kind, String message, String remediation, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.remediation = remediation;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String remediation() {
        return remediation;
    }
}
