package com.filingsync.ingestion.domain;

import java.time.Instant;

/**
 * Issuer attributes observed in one batch. Null attributes were not part of the observation
 * and leave the stored value untouched.
 */
public record IssuerRecord(
    String issuerId,
    String name,
    String jurisdiction,
    String issuerType,
    Boolean inDefault,
    Boolean activeRestriction,
    Instant observedAt
) {
    public static IssuerRecord seenInFiling(String issuerId, String name, Instant observedAt) {
        return new IssuerRecord(issuerId, name, null, null, null, null, observedAt);
    }

    public IssuerRecord observedAt(Instant instant) {
        return new IssuerRecord(issuerId, name, jurisdiction, issuerType, inDefault, activeRestriction, instant);
    }
}
