package com.filingsync.ingestion.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "issuers")
public class IssuerEntity {

    @Id
    @Column(name = "issuer_id", nullable = false, updatable = false)
    private String issuerId;

    @Column(name = "name")
    private String name;

    @Column(name = "jurisdiction")
    private String jurisdiction;

    @Column(name = "issuer_type")
    private String issuerType;

    @Column(name = "in_default", nullable = false)
    private boolean inDefault;

    @Column(name = "active_restriction", nullable = false)
    private boolean activeRestriction;

    @Column(name = "first_seen", nullable = false, updatable = false)
    private Instant firstSeen;

    @Column(name = "last_seen", nullable = false)
    private Instant lastSeen;

    public static IssuerEntity firstSeen(IssuerRecord record) {
        IssuerEntity entity = new IssuerEntity();
        entity.issuerId = record.issuerId();
        entity.firstSeen = record.observedAt();
        entity.lastSeen = record.observedAt();
        entity.updateFrom(record);
        return entity;
    }

    /**
     * Attributes are last-write-wins; {@code lastSeen} only ever moves forward.
     */
    public void updateFrom(IssuerRecord record) {
        if (record.name() != null) {
            this.name = record.name();
        }
        if (record.jurisdiction() != null) {
            this.jurisdiction = record.jurisdiction();
        }
        if (record.issuerType() != null) {
            this.issuerType = record.issuerType();
        }
        if (record.inDefault() != null) {
            this.inDefault = record.inDefault();
        }
        if (record.activeRestriction() != null) {
            this.activeRestriction = record.activeRestriction();
        }
        if (record.observedAt() != null && (lastSeen == null || record.observedAt().isAfter(lastSeen))) {
            this.lastSeen = record.observedAt();
        }
    }

    public String getIssuerId() {
        return issuerId;
    }

    public String getName() {
        return name;
    }

    public String getJurisdiction() {
        return jurisdiction;
    }

    public String getIssuerType() {
        return issuerType;
    }

    public boolean isInDefault() {
        return inDefault;
    }

    public boolean isActiveRestriction() {
        return activeRestriction;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }
}
