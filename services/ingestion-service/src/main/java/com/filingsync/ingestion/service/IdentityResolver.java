package com.filingsync.ingestion.service;

import com.filingsync.ingestion.config.IngestionProperties;
import com.filingsync.ingestion.domain.ComparisonField;
import com.filingsync.ingestion.domain.Decision;
import com.filingsync.ingestion.domain.FilingEntity;
import com.filingsync.ingestion.domain.FilingStatus;
import com.filingsync.ingestion.domain.ObservedFiling;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Decides whether an observed filing is new, a duplicate, an amendment of the active version, or
 * a retry of a version whose content fetch failed.
 *
 * <p>Only the configured {@link ComparisonField}s count as a change; anything else the portal
 * reports (issuer name, row order) never creates a new version. When the portal flags a row as an
 * amendment and the flag is honoured, the flag alone is enough, but a version created from a
 * flagged row is not amended again by the same flagged row.
 */
@Component
public class IdentityResolver {

    private final Set<ComparisonField> comparisonFields;
    private final boolean honorAmendmentMarker;

    public IdentityResolver(IngestionProperties properties) {
        this.comparisonFields = properties.comparisonFieldSet();
        this.honorAmendmentMarker = properties.isHonorAmendmentMarker();
    }

    /**
     * Reduces a batch to one observation per document identity, keeping the latest filing date and,
     * among equal dates, the later row. Insertion order of first appearance is preserved.
     */
    public Map<String, ObservedFiling> collapse(List<ObservedFiling> batch) {
        Map<String, ObservedFiling> latest = new LinkedHashMap<>();
        for (ObservedFiling observed : batch) {
            latest.merge(observed.documentIdentity(), observed,
                (current, candidate) -> candidate.filedOn().isBefore(current.filedOn()) ? current : candidate);
        }
        return latest;
    }

    /**
     * @param history every stored version of the observed identity, in any order
     */
    public Resolution resolve(ObservedFiling observed, List<FilingEntity> history) {
        if (history == null || history.isEmpty()) {
            return new Resolution(Decision.NEW, observed, 1, null, "first observation");
        }

        FilingEntity latest = history.stream()
            .max(Comparator.comparingInt(FilingEntity::getVersion))
            .orElseThrow();
        FilingEntity active = history.stream()
            .filter(FilingEntity::isActive)
            .max(Comparator.comparingInt(FilingEntity::getVersion))
            .orElse(null);

        if (latest.getStatus() == FilingStatus.FAILED) {
            return new Resolution(Decision.RETRY, observed, latest.getVersion(), active,
                "version " + latest.getVersion() + " failed previously");
        }
        if (active == null) {
            return new Resolution(Decision.NEW, observed, latest.getVersion() + 1, null, "no active version");
        }

        boolean markerAmends = honorAmendmentMarker && observed.amendment() && !active.isAmendmentMarker();
        if (!markerAmends && sameAs(observed, active)) {
            return new Resolution(Decision.DUPLICATE, observed, active.getVersion(), active, "unchanged");
        }
        if (!markerAmends && isStale(observed, active, history)) {
            return new Resolution(Decision.DUPLICATE, observed, active.getVersion(), active, "stale re-observation");
        }
        return new Resolution(Decision.AMENDMENT, observed, latest.getVersion() + 1, active,
            markerAmends ? "amendment flagged by portal" : "differs from version " + active.getVersion());
    }

    private boolean sameAs(ObservedFiling observed, FilingEntity stored) {
        for (ComparisonField field : comparisonFields) {
            if (!field.matches(observed, stored)) {
                return false;
            }
        }
        return true;
    }

    // An older row replayed from an overlapping window must not flip the chain back.
    private boolean isStale(ObservedFiling observed, FilingEntity active, List<FilingEntity> history) {
        if (comparisonFields.contains(ComparisonField.FILED_ON) && observed.filedOn().isBefore(active.getFiledOn())) {
            return true;
        }
        return history.stream()
            .filter(stored -> stored.getStatus() == FilingStatus.SUPERSEDED)
            .anyMatch(stored -> sameAs(observed, stored));
    }
}
