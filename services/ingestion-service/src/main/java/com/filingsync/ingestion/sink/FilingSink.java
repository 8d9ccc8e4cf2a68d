package com.filingsync.ingestion.sink;

import com.filingsync.ingestion.domain.FilingEntity;
import com.filingsync.ingestion.domain.IssuerRecord;
import java.util.List;
import java.util.UUID;

/**
 * Destination for reconciliation intents. Every write is keyed by document identity and version
 * and must be safe to apply again when a run is retried. Each call is atomic on its own; there
 * are no cross-record transactions.
 */
public interface FilingSink {

    /**
     * All stored versions of a document identity, oldest first.
     */
    List<FilingEntity> findHistory(String documentIdentity);

    void upsertIssuer(IssuerRecord issuer);

    FilingEntity upsertFilingActive(FilingEntity record);

    /**
     * Stores {@code newRecord} as the active version and flips the record {@code oldId} to superseded.
     */
    FilingEntity supersede(UUID oldId, FilingEntity newRecord);

    /**
     * Stores a version whose content could not be fetched. An existing non-failed row for the same
     * version is left as it is.
     */
    FilingEntity markFailed(FilingEntity record);
}
