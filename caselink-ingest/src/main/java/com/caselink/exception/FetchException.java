package com.caselink.exception;

/** A request exhausted its retry budget. */
public class FetchException extends IngestionException {

    private final String url;
    private final int attempts;

    public FetchException(String url, int attempts, Throwable cause) {
        super("Fetch failed after " + attempts + " attempt(s) for " + url + ": "
            + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.url = url;
        this.attempts = attempts;
    }

    public String getUrl() {
        return url;
    }

    public int getAttempts() {
        return attempts;
    }
}
