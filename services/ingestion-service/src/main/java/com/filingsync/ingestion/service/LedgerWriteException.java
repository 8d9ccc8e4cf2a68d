package com.filingsync.ingestion.service;

/**
 * The job ledger could not be written. A run cannot claim an outcome it cannot record, so this
 * always ends the run.
 */
public class LedgerWriteException extends RuntimeException {

    public LedgerWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
