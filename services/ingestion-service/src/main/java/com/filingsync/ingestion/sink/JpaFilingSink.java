package com.filingsync.ingestion.sink;

import com.filingsync.ingestion.domain.FilingEntity;
import com.filingsync.ingestion.domain.FilingStatus;
import com.filingsync.ingestion.domain.IssuerEntity;
import com.filingsync.ingestion.domain.IssuerRecord;
import com.filingsync.ingestion.repository.FilingRepository;
import com.filingsync.ingestion.repository.IssuerRepository;
import jakarta.transaction.Transactional;
import java.util.List;
import java.util.UUID;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
public class JpaFilingSink implements FilingSink {

    private final FilingRepository filingRepository;
    private final IssuerRepository issuerRepository;

    public JpaFilingSink(FilingRepository filingRepository, IssuerRepository issuerRepository) {
        this.filingRepository = filingRepository;
        this.issuerRepository = issuerRepository;
    }

    @Override
    public List<FilingEntity> findHistory(String documentIdentity) {
        return filingRepository.findByDocumentIdentityOrderByVersionAsc(documentIdentity);
    }

    @Override
    @Transactional
    public void upsertIssuer(IssuerRecord issuer) {
        try {
            IssuerEntity entity = issuerRepository.findById(issuer.issuerId())
                .map(existing -> {
                    existing.updateFrom(issuer);
                    return existing;
                })
                .orElseGet(() -> IssuerEntity.firstSeen(issuer));
            issuerRepository.saveAndFlush(entity);
        } catch (DataAccessException ex) {
            throw new SinkWriteException("Failed to upsert issuer " + issuer.issuerId(), ex);
        }
    }

    @Override
    @Transactional
    public FilingEntity upsertFilingActive(FilingEntity record) {
        try {
            ensureNoOtherActive(record);
            record.markActive();
            return filingRepository.saveAndFlush(merge(record));
        } catch (DataAccessException ex) {
            throw new SinkWriteException("Failed to store active filing " + key(record), ex);
        }
    }

    @Override
    @Transactional
    public FilingEntity supersede(UUID oldId, FilingEntity newRecord) {
        try {
            FilingEntity prior = filingRepository.findById(oldId)
                .orElseThrow(() -> new SinkWriteException("Superseded filing not found: " + oldId));
            if (!prior.getDocumentIdentity().equals(newRecord.getDocumentIdentity())) {
                throw new SinkWriteException("Cannot supersede " + key(prior) + " with " + key(newRecord));
            }
            if (prior.getVersion() >= newRecord.getVersion()) {
                throw new SinkWriteException("Version " + newRecord.getVersion() + " does not follow " + key(prior));
            }

            newRecord.setSupersedes(oldId);
            newRecord.markActive();
            FilingEntity saved = filingRepository.saveAndFlush(merge(newRecord));
            if (prior.getStatus() != FilingStatus.SUPERSEDED || !saved.getId().equals(prior.getSupersededBy())) {
                prior.markSupersededBy(saved.getId());
                filingRepository.saveAndFlush(prior);
            }
            return saved;
        } catch (DataAccessException ex) {
            throw new SinkWriteException("Failed to supersede " + oldId + " with " + key(newRecord), ex);
        }
    }

    @Override
    @Transactional
    public FilingEntity markFailed(FilingEntity record) {
        try {
            FilingEntity existing = filingRepository
                .findByDocumentIdentityAndVersion(record.getDocumentIdentity(), record.getVersion())
                .orElse(null);
            if (existing != null && existing.getStatus() != FilingStatus.FAILED) {
                return existing;
            }
            if (existing != null) {
                existing.absorb(record);
                return filingRepository.saveAndFlush(existing);
            }
            return filingRepository.saveAndFlush(record);
        } catch (DataAccessException ex) {
            throw new SinkWriteException("Failed to record failed filing " + key(record), ex);
        }
    }

    private FilingEntity merge(FilingEntity incoming) {
        return filingRepository
            .findByDocumentIdentityAndVersion(incoming.getDocumentIdentity(), incoming.getVersion())
            .map(existing -> {
                existing.absorb(incoming);
                return existing;
            })
            .orElse(incoming);
    }

    private void ensureNoOtherActive(FilingEntity record) {
        for (FilingEntity stored : filingRepository.findByDocumentIdentityOrderByVersionAsc(record.getDocumentIdentity())) {
            if (stored.isActive() && stored.getVersion() != record.getVersion()) {
                throw new SinkWriteException(record.getDocumentIdentity() + " already has active version " + stored.getVersion());
            }
        }
    }

    private String key(FilingEntity record) {
        return record.getDocumentIdentity() + " v" + record.getVersion();
    }
}
