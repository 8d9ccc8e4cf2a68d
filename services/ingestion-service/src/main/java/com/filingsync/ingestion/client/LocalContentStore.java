package com.filingsync.ingestion.client;

import com.filingsync.ingestion.domain.ContentLocation;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Keeps small documents inline and writes larger ones under a base directory.
 *
 * <p>Files are laid out as {@code <identity>-<identity hash>/<content sha256>.pdf}. A new version of a
 * filing never overwrites the file an earlier version references, and identities that sanitize to the
 * same name still get separate directories.
 */
public class LocalContentStore implements ContentStore {

    private static final int IDENTITY_HASH_CHARS = 12;

    private final Path basePath;
    private final int inlineMaxBytes;

    public LocalContentStore(Path basePath, int inlineMaxBytes) {
        this.basePath = basePath;
        this.inlineMaxBytes = inlineMaxBytes;
    }

    @Override
    public ContentLocation put(String documentIdentity, byte[] bytes) {
        if (bytes.length <= inlineMaxBytes) {
            return ContentLocation.inline(bytes);
        }
        try {
            Path directory = basePath.resolve(directoryName(documentIdentity));
            Files.createDirectories(directory);
            Path target = directory.resolve(sha256(bytes) + ".pdf");
            Files.write(target, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return ContentLocation.reference(target.toAbsolutePath().toString());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to store filing content for " + documentIdentity, e);
        }
    }

    private String directoryName(String documentIdentity) {
        String safe = documentIdentity.replaceAll("[^A-Za-z0-9._-]", "_");
        String identityHash = sha256(documentIdentity.getBytes(StandardCharsets.UTF_8)).substring(0, IDENTITY_HASH_CHARS);
        return safe + "-" + identityHash;
    }

    private String sha256(byte[] payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(payload));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
