package com.filingsync.ingestion.repository;

import com.filingsync.ingestion.domain.RunLedgerEntity;
import com.filingsync.ingestion.domain.RunMode;
import com.filingsync.ingestion.domain.RunStatus;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RunLedgerRepository extends JpaRepository<RunLedgerEntity, UUID> {

    Optional<RunLedgerEntity> findFirstByModeAndStatusOrderByWindowEndDesc(RunMode mode, RunStatus status);
}
