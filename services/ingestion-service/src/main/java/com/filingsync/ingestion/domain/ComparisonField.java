package com.filingsync.ingestion.domain;

import java.util.Objects;

/**
 * Fields the source portal can change independently for a document identity.
 * Only these take part in the duplicate-versus-amendment comparison.
 */
public enum ComparisonField {
    FILED_ON {
        @Override
        public boolean matches(ObservedFiling observed, FilingEntity stored) {
            return Objects.equals(observed.filedOn(), stored.getFiledOn());
        }
    },
    FILING_TYPE {
        @Override
        public boolean matches(ObservedFiling observed, FilingEntity stored) {
            return normalize(observed.filingType()).equals(normalize(stored.getFilingType()));
        }
    },
    DOCUMENT_TYPE {
        @Override
        public boolean matches(ObservedFiling observed, FilingEntity stored) {
            return normalize(observed.documentType()).equals(normalize(stored.getDocumentType()));
        }
    },
    CONTENT_REFERENCE {
        @Override
        public boolean matches(ObservedFiling observed, FilingEntity stored) {
            return normalize(observed.sourceUrl()).equals(normalize(stored.getSourceUrl()));
        }
    };

    public abstract boolean matches(ObservedFiling observed, FilingEntity stored);

    private static String normalize(String value) {
        return value == null ? "" : value.trim();
    }
}
