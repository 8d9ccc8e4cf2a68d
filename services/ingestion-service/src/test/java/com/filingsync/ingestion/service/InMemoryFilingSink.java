package com.filingsync.ingestion.service;

import com.filingsync.ingestion.domain.FilingEntity;
import com.filingsync.ingestion.domain.FilingStatus;
import com.filingsync.ingestion.domain.IssuerRecord;
import com.filingsync.ingestion.sink.FilingSink;
import com.filingsync.ingestion.sink.SinkWriteException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed sink with the same merge rules as the JPA sink.
 */
class InMemoryFilingSink implements FilingSink {

    private final List<FilingEntity> filings = new ArrayList<>();
    private final Map<String, IssuerRecord> issuers = new LinkedHashMap<>();
    private final Set<String> failingIdentities = ConcurrentHashMap.newKeySet();

    void failWritesFor(String documentIdentity) {
        failingIdentities.add(documentIdentity);
    }

    void seed(FilingEntity record) {
        filings.add(record);
    }

    synchronized List<FilingEntity> all() {
        return new ArrayList<>(filings);
    }

    synchronized Map<String, IssuerRecord> issuers() {
        return new LinkedHashMap<>(issuers);
    }

    synchronized FilingEntity active(String documentIdentity) {
        List<FilingEntity> active = findHistory(documentIdentity).stream().filter(FilingEntity::isActive).toList();
        if (active.size() > 1) {
            throw new AssertionError("More than one active version of " + documentIdentity);
        }
        return active.isEmpty() ? null : active.get(0);
    }

    @Override
    public synchronized List<FilingEntity> findHistory(String documentIdentity) {
        return filings.stream()
            .filter(record -> record.getDocumentIdentity().equals(documentIdentity))
            .sorted(Comparator.comparingInt(FilingEntity::getVersion))
            .toList();
    }

    @Override
    public synchronized void upsertIssuer(IssuerRecord issuer) {
        issuers.merge(issuer.issuerId(), issuer, (current, incoming) -> new IssuerRecord(
            incoming.issuerId(),
            incoming.name() != null ? incoming.name() : current.name(),
            incoming.jurisdiction() != null ? incoming.jurisdiction() : current.jurisdiction(),
            incoming.issuerType() != null ? incoming.issuerType() : current.issuerType(),
            incoming.inDefault() != null ? incoming.inDefault() : current.inDefault(),
            incoming.activeRestriction() != null ? incoming.activeRestriction() : current.activeRestriction(),
            incoming.observedAt()
        ));
    }

    @Override
    public synchronized FilingEntity upsertFilingActive(FilingEntity record) {
        guard(record);
        for (FilingEntity stored : findHistory(record.getDocumentIdentity())) {
            if (stored.isActive() && stored.getVersion() != record.getVersion()) {
                throw new SinkWriteException(record.getDocumentIdentity() + " already has an active version");
            }
        }
        record.markActive();
        return merge(record);
    }

    @Override
    public synchronized FilingEntity supersede(UUID oldId, FilingEntity newRecord) {
        guard(newRecord);
        FilingEntity prior = filings.stream()
            .filter(record -> record.getId().equals(oldId))
            .findFirst()
            .orElseThrow(() -> new SinkWriteException("Superseded filing not found: " + oldId));
        newRecord.setSupersedes(oldId);
        newRecord.markActive();
        FilingEntity saved = merge(newRecord);
        prior.markSupersededBy(saved.getId());
        return saved;
    }

    @Override
    public synchronized FilingEntity markFailed(FilingEntity record) {
        guard(record);
        FilingEntity existing = find(record.getDocumentIdentity(), record.getVersion());
        if (existing != null && existing.getStatus() != FilingStatus.FAILED) {
            return existing;
        }
        return merge(record);
    }

    private void guard(FilingEntity record) {
        if (failingIdentities.contains(record.getDocumentIdentity())) {
            throw new SinkWriteException("simulated write failure for " + record.getDocumentIdentity());
        }
    }

    private FilingEntity merge(FilingEntity incoming) {
        FilingEntity existing = find(incoming.getDocumentIdentity(), incoming.getVersion());
        if (existing == null) {
            filings.add(incoming);
            return incoming;
        }
        existing.absorb(incoming);
        return existing;
    }

    private FilingEntity find(String documentIdentity, int version) {
        return filings.stream()
            .filter(record -> record.getDocumentIdentity().equals(documentIdentity) && record.getVersion() == version)
            .findFirst()
            .orElse(null);
    }
}
