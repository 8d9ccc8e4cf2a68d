package com.filingsync.ingestion.client;

public record FetchedContent(byte[] bytes, String sha256, Long declaredSize, boolean sizeMismatch) {

    public int length() {
        return bytes.length;
    }
}
