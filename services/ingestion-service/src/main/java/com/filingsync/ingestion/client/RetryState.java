package com.filingsync.ingestion.client;

/**
 * Position in a bounded exponential backoff sequence.
 */
record RetryState(int attempt, long nextDelayMs, long maxDelayMs) {

    static RetryState first(long baseDelayMs, long maxDelayMs) {
        return new RetryState(1, Math.min(baseDelayMs, maxDelayMs), maxDelayMs);
    }

    RetryState next() {
        long doubled = nextDelayMs > maxDelayMs / 2 ? maxDelayMs : nextDelayMs * 2;
        return new RetryState(attempt + 1, doubled, maxDelayMs);
    }

    boolean canRetry(int maxAttempts) {
        return attempt < maxAttempts;
    }
}
