package com.filingsync.ingestion.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "ingestion_failures")
public class IngestionFailureEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(name = "document_identity")
    private String documentIdentity;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_code", nullable = false)
    private FailureCode failureCode;

    @Column(name = "failure_reason", nullable = false)
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public static IngestionFailureEntity of(UUID runId, String documentIdentity, FailureCode code, String reason) {
        IngestionFailureEntity entity = new IngestionFailureEntity();
        entity.id = UUID.randomUUID();
        entity.runId = runId;
        entity.documentIdentity = documentIdentity;
        entity.failureCode = code;
        entity.failureReason = reason;
        entity.createdAt = Instant.now();
        return entity;
    }

    public UUID getId() {
        return id;
    }

    public UUID getRunId() {
        return runId;
    }

    public String getDocumentIdentity() {
        return documentIdentity;
    }

    public FailureCode getFailureCode() {
        return failureCode;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
