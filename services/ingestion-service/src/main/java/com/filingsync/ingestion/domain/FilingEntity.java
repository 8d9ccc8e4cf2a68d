package com.filingsync.ingestion.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One version of a filing. Rows are never deleted; a newer version flips the previous one to
 * {@link FilingStatus#SUPERSEDED}.
 */
@Entity
@Table(
    name = "filings",
    uniqueConstraints = @UniqueConstraint(name = "uq_filings_identity_version", columnNames = {"document_identity", "version"})
)
public class FilingEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "issuer_id", nullable = false)
    private String issuerId;

    @Column(name = "document_identity", nullable = false, updatable = false)
    private String documentIdentity;

    @Column(name = "filing_type")
    private String filingType;

    @Column(name = "document_type")
    private String documentType;

    @Column(name = "filed_on", nullable = false)
    private LocalDate filedOn;

    @Column(name = "version", nullable = false, updatable = false)
    private int version;

    @Column(name = "supersedes")
    private UUID supersedes;

    @Column(name = "superseded_by")
    private UUID supersededBy;

    @Column(name = "source_url")
    private String sourceUrl;

    @Column(name = "content_inline")
    private byte[] contentInline;

    @Column(name = "content_ref")
    private String contentRef;

    @Column(name = "size_bytes")
    private Long sizeBytes;

    @Column(name = "size_mismatch", nullable = false)
    private boolean sizeMismatch;

    @Column(name = "checksum")
    private String checksum;

    @Column(name = "amendment_marker", nullable = false)
    private boolean amendmentMarker;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private FilingStatus status;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static FilingEntity fromObservation(ObservedFiling observed, int version) {
        FilingEntity entity = new FilingEntity();
        entity.id = UUID.randomUUID();
        entity.issuerId = observed.issuerId();
        entity.documentIdentity = observed.documentIdentity();
        entity.filingType = observed.filingType();
        entity.documentType = observed.documentType();
        entity.filedOn = observed.filedOn();
        entity.version = version;
        entity.sourceUrl = observed.sourceUrl();
        entity.sizeBytes = observed.sizeBytes();
        entity.amendmentMarker = observed.amendment();
        entity.status = FilingStatus.ACTIVE;
        return entity;
    }

    /**
     * Copies everything a newer observation of the same (identity, version) may change onto this
     * stored row. Identity, version and id stay as stored.
     */
    public void absorb(FilingEntity incoming) {
        this.issuerId = incoming.issuerId;
        this.filingType = incoming.filingType;
        this.documentType = incoming.documentType;
        this.filedOn = incoming.filedOn;
        this.sourceUrl = incoming.sourceUrl;
        this.sizeBytes = incoming.sizeBytes;
        this.amendmentMarker = incoming.amendmentMarker;
        this.status = incoming.status;
        this.failureReason = incoming.failureReason;
        if (incoming.supersedes != null) {
            this.supersedes = incoming.supersedes;
        }
        if (incoming.status != FilingStatus.FAILED) {
            this.contentInline = incoming.contentInline;
            this.contentRef = incoming.contentRef;
            this.checksum = incoming.checksum;
            this.sizeMismatch = incoming.sizeMismatch;
        }
    }

    public void attachContent(ContentLocation location, String checksum, boolean sizeMismatch) {
        this.contentInline = location.inline();
        this.contentRef = location.reference();
        this.checksum = checksum;
        this.sizeMismatch = sizeMismatch;
        this.status = FilingStatus.ACTIVE;
        this.failureReason = null;
    }

    public void markFailed(String reason) {
        this.status = FilingStatus.FAILED;
        this.failureReason = reason;
    }

    public void markActive() {
        this.status = FilingStatus.ACTIVE;
        this.failureReason = null;
    }

    public void markSupersededBy(UUID newerId) {
        this.status = FilingStatus.SUPERSEDED;
        this.supersededBy = newerId;
    }

    public void setSupersedes(UUID supersedes) {
        this.supersedes = supersedes;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public boolean isActive() {
        return status == FilingStatus.ACTIVE;
    }

    public UUID getId() {
        return id;
    }

    public String getIssuerId() {
        return issuerId;
    }

    public String getDocumentIdentity() {
        return documentIdentity;
    }

    public String getFilingType() {
        return filingType;
    }

    public String getDocumentType() {
        return documentType;
    }

    public LocalDate getFiledOn() {
        return filedOn;
    }

    public int getVersion() {
        return version;
    }

    public UUID getSupersedes() {
        return supersedes;
    }

    public UUID getSupersededBy() {
        return supersededBy;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }

    public byte[] getContentInline() {
        return contentInline;
    }

    public String getContentRef() {
        return contentRef;
    }

    public Long getSizeBytes() {
        return sizeBytes;
    }

    public boolean isSizeMismatch() {
        return sizeMismatch;
    }

    public String getChecksum() {
        return checksum;
    }

    public boolean isAmendmentMarker() {
        return amendmentMarker;
    }

    public FilingStatus getStatus() {
        return status;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
