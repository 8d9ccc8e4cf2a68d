package com.filingsync.ingestion.service;

import com.filingsync.ingestion.domain.FailureCode;
import com.filingsync.ingestion.domain.FetchWindow;
import com.filingsync.ingestion.domain.IngestionFailureEntity;
import com.filingsync.ingestion.domain.RunLedgerEntity;
import com.filingsync.ingestion.domain.RunMode;
import com.filingsync.ingestion.domain.RunStatus;
import com.filingsync.ingestion.repository.IngestionFailureRepository;
import com.filingsync.ingestion.repository.RunLedgerRepository;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
public class JpaJobLedger implements JobLedger {

    private final RunLedgerRepository runLedgerRepository;
    private final IngestionFailureRepository ingestionFailureRepository;

    public JpaJobLedger(RunLedgerRepository runLedgerRepository, IngestionFailureRepository ingestionFailureRepository) {
        this.runLedgerRepository = runLedgerRepository;
        this.ingestionFailureRepository = ingestionFailureRepository;
    }

    @Override
    public RunLedgerEntity create(RunMode mode, FetchWindow window, Instant startedAt) {
        try {
            return runLedgerRepository.saveAndFlush(RunLedgerEntity.startNew(mode, window, startedAt));
        } catch (DataAccessException ex) {
            throw new LedgerWriteException("Failed to open ledger entry for " + mode + " run " + window, ex);
        }
    }

    @Override
    public void update(RunLedgerEntity run) {
        save(run, "update");
    }

    @Override
    public RunLedgerEntity finalizeRun(RunLedgerEntity run) {
        if (run.getStatus() == RunStatus.RUNNING) {
            throw new IllegalStateException("Run " + run.getRunId() + " has no final status");
        }
        return save(run, "finalize");
    }

    @Override
    public void recordFailure(UUID runId, String documentIdentity, FailureCode code, String reason) {
        try {
            ingestionFailureRepository.save(IngestionFailureEntity.of(runId, documentIdentity, code, reason));
        } catch (DataAccessException ex) {
            throw new LedgerWriteException("Failed to record " + code + " for run " + runId, ex);
        }
    }

    @Override
    public Optional<LocalDate> latestSuccessfulWatermark() {
        return runLedgerRepository
            .findFirstByModeAndStatusOrderByWindowEndDesc(RunMode.INCREMENTAL, RunStatus.COMPLETED)
            .map(RunLedgerEntity::getWindowEnd);
    }

    @Override
    public Optional<RunLedgerEntity> find(UUID runId) {
        return runLedgerRepository.findById(runId);
    }

    @Override
    public List<IngestionFailureEntity> recentFailures(UUID runId) {
        return ingestionFailureRepository.findTop20ByRunIdOrderByCreatedAtDesc(runId);
    }

    private RunLedgerEntity save(RunLedgerEntity run, String action) {
        try {
            return runLedgerRepository.saveAndFlush(run);
        } catch (DataAccessException ex) {
            throw new LedgerWriteException("Failed to " + action + " ledger entry " + run.getRunId(), ex);
        }
    }
}
