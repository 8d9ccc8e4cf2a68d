package com.filingsync.ingestion.service;

import com.filingsync.ingestion.domain.Decision;
import com.filingsync.ingestion.domain.FilingEntity;
import com.filingsync.ingestion.domain.ObservedFiling;
import java.util.UUID;

/**
 * What the resolver decided for one document identity.
 *
 * @param version version the resulting record is stored under
 * @param active  the currently active version, if any
 * @param reason  short explanation for logs
 */
public record Resolution(Decision decision, ObservedFiling observed, int version, FilingEntity active, String reason) {

    /**
     * Id of the active record the outcome replaces, or null when nothing is replaced.
     */
    public UUID supersedesId() {
        if (active == null || active.getVersion() >= version) {
            return null;
        }
        return decision == Decision.AMENDMENT || decision == Decision.RETRY ? active.getId() : null;
    }
}
