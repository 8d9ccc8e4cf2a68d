package com.filingsync.ingestion.domain;

/**
 * Outcome of comparing one observed filing against the stored history of its document identity.
 */
public enum Decision {
    NEW,
    DUPLICATE,
    AMENDMENT,
    RETRY;

    public boolean requiresContent() {
        return this != DUPLICATE;
    }
}
