package com.filingsync.ingestion.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive date range requested from the portal.
 */
public record FetchWindow(LocalDate start, LocalDate end) {

    public FetchWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Window bounds are required");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Window start " + start + " is after end " + end);
        }
    }

    public List<FetchWindow> split(int chunkDays) {
        if (chunkDays <= 0) {
            throw new IllegalArgumentException("chunkDays must be positive: " + chunkDays);
        }
        List<FetchWindow> chunks = new ArrayList<>();
        LocalDate cursor = start;
        while (!cursor.isAfter(end)) {
            LocalDate chunkEnd = cursor.plusDays(chunkDays - 1L);
            if (chunkEnd.isAfter(end)) {
                chunkEnd = end;
            }
            chunks.add(new FetchWindow(cursor, chunkEnd));
            cursor = chunkEnd.plusDays(1);
        }
        return chunks;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
