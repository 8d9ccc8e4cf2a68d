package com.filingsync.ingestion.service;

public class ActiveRunException extends RuntimeException {

    public ActiveRunException(String message) {
        super(message);
    }
}
