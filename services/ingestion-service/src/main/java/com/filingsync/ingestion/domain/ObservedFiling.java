package com.filingsync.ingestion.domain;

import java.time.LocalDate;

/**
 * One filing row as the portal reported it, before any reconciliation.
 */
public record ObservedFiling(
    String issuerId,
    String issuerName,
    String documentIdentity,
    String filingType,
    String documentType,
    LocalDate filedOn,
    String sourceUrl,
    Long sizeBytes,
    boolean amendment
) {
}
