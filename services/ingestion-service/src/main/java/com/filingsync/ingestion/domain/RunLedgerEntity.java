package com.filingsync.ingestion.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "run_ledger")
public class RunLedgerEntity {

    public static final int MAX_ERROR_DETAIL = 4000;

    @Id
    @Column(name = "run_id", nullable = false, updatable = false)
    private UUID runId;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", nullable = false, updatable = false)
    private RunMode mode;

    @Column(name = "window_start", nullable = false)
    private LocalDate windowStart;

    @Column(name = "window_end", nullable = false)
    private LocalDate windowEnd;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private RunStatus status;

    @Column(name = "records_seen", nullable = false)
    private int recordsSeen;

    @Column(name = "records_new", nullable = false)
    private int recordsNew;

    @Column(name = "records_superseded", nullable = false)
    private int recordsSuperseded;

    @Column(name = "records_failed", nullable = false)
    private int recordsFailed;

    @Column(name = "records_errored", nullable = false)
    private int recordsErrored;

    @Column(name = "records_retried", nullable = false)
    private int recordsRetried;

    @Column(name = "size_mismatches", nullable = false)
    private int sizeMismatches;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "error_detail", length = MAX_ERROR_DETAIL)
    private String errorDetail;

    public static RunLedgerEntity startNew(RunMode mode, FetchWindow window, Instant startedAt) {
        RunLedgerEntity run = new RunLedgerEntity();
        run.runId = UUID.randomUUID();
        run.mode = mode;
        run.windowStart = window.start();
        run.windowEnd = window.end();
        run.startedAt = startedAt;
        run.status = RunStatus.RUNNING;
        return run;
    }

    public void addSeen(int count) {
        this.recordsSeen += count;
    }

    public void incrementNew() {
        this.recordsNew++;
    }

    public void incrementSuperseded() {
        this.recordsSuperseded++;
    }

    public void incrementFailed() {
        this.recordsFailed++;
    }

    public void incrementErrored() {
        this.recordsErrored++;
    }

    public void incrementRetried() {
        this.recordsRetried++;
    }

    public void incrementSizeMismatches() {
        this.sizeMismatches++;
    }

    public void complete(Instant endedAt, String errorDetail) {
        this.endedAt = endedAt;
        this.status = RunStatus.COMPLETED;
        this.errorDetail = truncate(errorDetail);
    }

    public void fail(Instant endedAt, String errorDetail) {
        this.endedAt = endedAt;
        this.status = RunStatus.FAILED;
        String detail = truncate(errorDetail);
        this.errorDetail = detail == null || detail.isBlank() ? "unknown" : detail;
    }

    public FetchWindow window() {
        return new FetchWindow(windowStart, windowEnd);
    }

    private static String truncate(String text) {
        if (text == null) {
            return null;
        }
        return text.length() <= MAX_ERROR_DETAIL ? text : text.substring(0, MAX_ERROR_DETAIL);
    }

    public UUID getRunId() {
        return runId;
    }

    public RunMode getMode() {
        return mode;
    }

    public LocalDate getWindowStart() {
        return windowStart;
    }

    public LocalDate getWindowEnd() {
        return windowEnd;
    }

    public RunStatus getStatus() {
        return status;
    }

    public int getRecordsSeen() {
        return recordsSeen;
    }

    public int getRecordsNew() {
        return recordsNew;
    }

    public int getRecordsSuperseded() {
        return recordsSuperseded;
    }

    public int getRecordsFailed() {
        return recordsFailed;
    }

    public int getRecordsErrored() {
        return recordsErrored;
    }

    public int getRecordsRetried() {
        return recordsRetried;
    }

    public int getSizeMismatches() {
        return sizeMismatches;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public String getErrorDetail() {
        return errorDetail;
    }
}
