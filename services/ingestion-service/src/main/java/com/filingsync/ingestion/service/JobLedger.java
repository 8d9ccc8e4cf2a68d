package com.filingsync.ingestion.service;

import com.filingsync.ingestion.domain.FailureCode;
import com.filingsync.ingestion.domain.FetchWindow;
import com.filingsync.ingestion.domain.IngestionFailureEntity;
import com.filingsync.ingestion.domain.RunLedgerEntity;
import com.filingsync.ingestion.domain.RunMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bookkeeping for pipeline runs. Every write either succeeds or throws {@link LedgerWriteException}.
 */
public interface JobLedger {

    RunLedgerEntity create(RunMode mode, FetchWindow window, Instant startedAt);

    void update(RunLedgerEntity run);

    RunLedgerEntity finalizeRun(RunLedgerEntity run);

    void recordFailure(UUID runId, String documentIdentity, FailureCode code, String reason);

    /**
     * Window end of the most recent completed incremental run.
     */
    Optional<LocalDate> latestSuccessfulWatermark();

    Optional<RunLedgerEntity> find(UUID runId);

    List<IngestionFailureEntity> recentFailures(UUID runId);
}
