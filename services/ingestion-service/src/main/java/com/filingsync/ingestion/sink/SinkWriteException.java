package com.filingsync.ingestion.sink;

/**
 * A single intent could not be written. Recorded against the run, never fatal to it.
 */
public class SinkWriteException extends RuntimeException {

    public SinkWriteException(String message) {
        super(message);
    }

    public SinkWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
