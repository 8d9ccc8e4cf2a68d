package com.filingsync.ingestion.controller;

import com.filingsync.ingestion.domain.FailureCode;
import com.filingsync.ingestion.domain.RunMode;
import com.filingsync.ingestion.domain.RunStatus;
import com.filingsync.ingestion.domain.RunSummary;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record IngestionRunResponse(
    UUID runId,
    RunMode mode,
    RunStatus status,
    LocalDate windowStart,
    LocalDate windowEnd,
    Instant startedAt,
    Instant endedAt,
    int recordsSeen,
    int recordsNew,
    int recordsSuperseded,
    int recordsFailed,
    int recordsErrored,
    int recordsRetried,
    int sizeMismatches,
    String errorDetail,
    List<FailureItem> recentFailures
) {
    public static IngestionRunResponse from(RunSummary summary, List<FailureItem> failures) {
        return new IngestionRunResponse(
            summary.runId(),
            summary.mode(),
            summary.status(),
            summary.windowStart(),
            summary.windowEnd(),
            summary.startedAt(),
            summary.endedAt(),
            summary.recordsSeen(),
            summary.recordsNew(),
            summary.recordsSuperseded(),
            summary.recordsFailed(),
            summary.recordsErrored(),
            summary.recordsRetried(),
            summary.sizeMismatches(),
            summary.errorDetail(),
            failures
        );
    }

    public record FailureItem(String documentIdentity, FailureCode code, String reason, Instant createdAt) {
    }
}
