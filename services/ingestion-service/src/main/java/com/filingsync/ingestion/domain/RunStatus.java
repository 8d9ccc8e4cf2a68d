package com.filingsync.ingestion.domain;

public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
