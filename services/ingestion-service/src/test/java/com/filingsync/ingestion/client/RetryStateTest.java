package com.filingsync.ingestion.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryStateTest {

    @Test
    void delayDoublesUntilCapped() {
        RetryState state = RetryState.first(1_000, 5_000);
        assertEquals(1, state.attempt());
        assertEquals(1_000, state.nextDelayMs());

        state = state.next();
        assertEquals(2_000, state.nextDelayMs());
        state = state.next();
        assertEquals(4_000, state.nextDelayMs());
        state = state.next();
        assertEquals(5_000, state.nextDelayMs());
        assertEquals(4, state.attempt());
    }

    @Test
    void stopsAtMaxAttempts() {
        RetryState state = RetryState.first(1, 10);
        assertTrue(state.canRetry(2));
        assertFalse(state.next().canRetry(2));
    }
}
