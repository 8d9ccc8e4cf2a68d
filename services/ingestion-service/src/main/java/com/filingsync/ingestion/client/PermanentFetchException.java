package com.filingsync.ingestion.client;

/**
 * Non-retryable portal failure: a 4xx other than 429, an unreadable response, or a pagination
 * sequence that never terminates.
 */
public class PermanentFetchException extends FetchException {

    private final int status;

    public PermanentFetchException(String operation, int status, String message) {
        this(operation, status, message, null);
    }

    public PermanentFetchException(String operation, int status, String message, Throwable cause) {
        super(operation, message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
