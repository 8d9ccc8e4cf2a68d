package com.filingsync.ingestion.service;

import com.filingsync.ingestion.domain.FailureCode;
import com.filingsync.ingestion.domain.FetchWindow;
import com.filingsync.ingestion.domain.IngestionFailureEntity;
import com.filingsync.ingestion.domain.RunLedgerEntity;
import com.filingsync.ingestion.domain.RunMode;
import com.filingsync.ingestion.domain.RunStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

class InMemoryJobLedger implements JobLedger {

    private final Map<UUID, RunLedgerEntity> runs = new LinkedHashMap<>();
    private final List<IngestionFailureEntity> failures = new ArrayList<>();

    synchronized void seedCompletedIncremental(FetchWindow window, Instant at) {
        RunLedgerEntity run = RunLedgerEntity.startNew(RunMode.INCREMENTAL, window, at);
        run.complete(at, null);
        runs.put(run.getRunId(), run);
    }

    synchronized UUID lastRunId() {
        UUID last = null;
        for (UUID runId : runs.keySet()) {
            last = runId;
        }
        return last;
    }

    synchronized List<IngestionFailureEntity> failures() {
        return new ArrayList<>(failures);
    }

    @Override
    public synchronized RunLedgerEntity create(RunMode mode, FetchWindow window, Instant startedAt) {
        RunLedgerEntity run = RunLedgerEntity.startNew(mode, window, startedAt);
        runs.put(run.getRunId(), run);
        return run;
    }

    @Override
    public synchronized void update(RunLedgerEntity run) {
        runs.put(run.getRunId(), run);
    }

    @Override
    public synchronized RunLedgerEntity finalizeRun(RunLedgerEntity run) {
        if (run.getStatus() == RunStatus.RUNNING) {
            throw new IllegalStateException("Run " + run.getRunId() + " has no final status");
        }
        runs.put(run.getRunId(), run);
        return run;
    }

    @Override
    public synchronized void recordFailure(UUID runId, String documentIdentity, FailureCode code, String reason) {
        failures.add(IngestionFailureEntity.of(runId, documentIdentity, code, reason));
    }

    @Override
    public synchronized Optional<LocalDate> latestSuccessfulWatermark() {
        return runs.values().stream()
            .filter(run -> run.getMode() == RunMode.INCREMENTAL && run.getStatus() == RunStatus.COMPLETED)
            .map(RunLedgerEntity::getWindowEnd)
            .max(Comparator.naturalOrder());
    }

    @Override
    public synchronized Optional<RunLedgerEntity> find(UUID runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public synchronized List<IngestionFailureEntity> recentFailures(UUID runId) {
        return failures.stream().filter(failure -> failure.getRunId().equals(runId)).toList();
    }
}
