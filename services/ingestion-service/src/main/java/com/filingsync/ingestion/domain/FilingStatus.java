package com.filingsync.ingestion.domain;

public enum FilingStatus {
    ACTIVE,
    SUPERSEDED,
    FAILED
}
