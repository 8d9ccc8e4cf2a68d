package com.filingsync.ingestion.client;

/**
 * Network error, 5xx or 429 that persisted through every allowed attempt.
 */
public class TransientFetchException extends FetchException {

    private final int attempts;
    private final int lastStatus;

    public TransientFetchException(String operation, int attempts, int lastStatus, String lastError, Throwable cause) {
        super(operation, "gave up after " + attempts + " attempt(s), last status "
            + (lastStatus == 0 ? "none" : String.valueOf(lastStatus))
            + (lastError == null ? "" : ", " + lastError), cause);
        this.attempts = attempts;
        this.lastStatus = lastStatus;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getLastStatus() {
        return lastStatus;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
