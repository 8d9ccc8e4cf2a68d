package com.filingsync.ingestion.client;

/**
 * Base type for portal call failures.
 */
public abstract class FetchException extends RuntimeException {

    private final String operation;

    protected FetchException(String operation, String message, Throwable cause) {
        super(operation + ": " + message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    public abstract boolean isRetryable();
}
