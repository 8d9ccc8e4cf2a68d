package com.filingsync.ingestion.client;

import java.util.List;

/**
 * One page of a paginated portal export. A null {@code nextPageToken} means the export is exhausted.
 * {@code rejectedRows} describes rows the portal returned that could not be read.
 */
public record PortalPage<T>(List<T> records, String nextPageToken, List<String> rejectedRows) {

    public PortalPage(List<T> records, String nextPageToken) {
        this(records, nextPageToken, List.of());
    }

    public boolean hasNext() {
        return nextPageToken != null;
    }
}
