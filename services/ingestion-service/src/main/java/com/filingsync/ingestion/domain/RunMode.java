package com.filingsync.ingestion.domain;

public enum RunMode {
    INCREMENTAL,
    HISTORICAL
}
