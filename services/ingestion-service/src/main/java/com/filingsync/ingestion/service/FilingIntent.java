package com.filingsync.ingestion.service;

import com.filingsync.ingestion.domain.FilingEntity;

/**
 * A write the engine hands to the sink, built by exactly one worker and merged by the run.
 */
record FilingIntent(Resolution resolution, FilingEntity record, String failureReason, FetchedLength sizeCheck) {

    record FetchedLength(Long declared, int fetched) {
    }

    static FilingIntent ready(Resolution resolution, FilingEntity record, FetchedLength sizeCheck) {
        return new FilingIntent(resolution, record, null, sizeCheck);
    }

    static FilingIntent contentFailed(Resolution resolution, FilingEntity record, String reason) {
        return new FilingIntent(resolution, record, reason, null);
    }

    boolean isContentFailed() {
        return failureReason != null;
    }

    boolean hasSizeMismatch() {
        return sizeCheck != null;
    }

    String documentIdentity() {
        return record.getDocumentIdentity();
    }
}
