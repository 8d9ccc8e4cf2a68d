package com.filingsync.ingestion.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record RunSummary(
    UUID runId,
    RunMode mode,
    RunStatus status,
    LocalDate windowStart,
    LocalDate windowEnd,
    int recordsSeen,
    int recordsNew,
    int recordsSuperseded,
    int recordsFailed,
    int recordsErrored,
    int recordsRetried,
    int sizeMismatches,
    Instant startedAt,
    Instant endedAt,
    String errorDetail
) {
    public static RunSummary from(RunLedgerEntity run) {
        return new RunSummary(
            run.getRunId(),
            run.getMode(),
            run.getStatus(),
            run.getWindowStart(),
            run.getWindowEnd(),
            run.getRecordsSeen(),
            run.getRecordsNew(),
            run.getRecordsSuperseded(),
            run.getRecordsFailed(),
            run.getRecordsErrored(),
            run.getRecordsRetried(),
            run.getSizeMismatches(),
            run.getStartedAt(),
            run.getEndedAt(),
            run.getErrorDetail()
        );
    }
}
