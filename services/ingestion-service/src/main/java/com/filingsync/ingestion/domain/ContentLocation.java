package com.filingsync.ingestion.domain;

/**
 * Where a filing's bytes live: either inline or behind an external reference, never both.
 */
public record ContentLocation(byte[] inline, String reference) {

    public ContentLocation {
        if ((inline == null) == (reference == null)) {
            throw new IllegalArgumentException("Exactly one of inline content or reference must be set");
        }
    }

    public static ContentLocation inline(byte[] bytes) {
        return new ContentLocation(bytes, null);
    }

    public static ContentLocation reference(String reference) {
        return new ContentLocation(null, reference);
    }

    public boolean isInline() {
        return inline != null;
    }
}
