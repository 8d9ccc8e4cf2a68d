package com.filingsync.ingestion.domain;

public enum FailureCode {
    CONTENT_FETCH_ERROR,
    SINK_WRITE_ERROR,
    SIZE_MISMATCH,
    ISSUER_REFRESH_ERROR,
    MALFORMED_ROW
}
