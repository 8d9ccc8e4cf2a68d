package com.filingsync.ingestion.client;

import com.filingsync.ingestion.domain.ContentLocation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class LocalContentStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void keepsSmallContentInline() {
        LocalContentStore store = new LocalContentStore(tempDir, 16);

        ContentLocation location = store.put("GUID-1", new byte[16]);

        assertThat(location.isInline()).isTrue();
        assertThat(location.reference()).isNull();
    }

    @Test
    void writesLargeContentToFile() throws Exception {
        LocalContentStore store = new LocalContentStore(tempDir.resolve("filings"), 4);
        byte[] bytes = "%PDF-1.7 content".getBytes(StandardCharsets.UTF_8);

        ContentLocation location = store.put("GUID/2", bytes);

        assertThat(location.isInline()).isFalse();
        Path written = Path.of(location.reference());
        assertThat(written.getParent().getFileName().toString()).startsWith("GUID_2-");
        assertThat(written.getFileName().toString()).matches("[0-9a-f]{64}\\.pdf");
        assertThat(Files.readAllBytes(written)).isEqualTo(bytes);
    }

    @Test
    void newVersionDoesNotOverwriteEarlierContent() throws Exception {
        LocalContentStore store = new LocalContentStore(tempDir, 4);
        byte[] original = "%PDF-1.7 original".getBytes(StandardCharsets.UTF_8);
        byte[] amended = "%PDF-1.7 amended".getBytes(StandardCharsets.UTF_8);

        ContentLocation first = store.put("GUID-3", original);
        ContentLocation second = store.put("GUID-3", amended);

        assertThat(second.reference()).isNotEqualTo(first.reference());
        assertThat(Files.readAllBytes(Path.of(first.reference()))).isEqualTo(original);
        assertThat(Files.readAllBytes(Path.of(second.reference()))).isEqualTo(amended);
    }

    @Test
    void identitiesThatSanitizeAlikeDoNotCollide() throws Exception {
        LocalContentStore store = new LocalContentStore(tempDir, 4);
        byte[] bytes = "%PDF-1.7 shared".getBytes(StandardCharsets.UTF_8);

        ContentLocation slash = store.put("GUID/4", bytes);
        ContentLocation underscore = store.put("GUID_4", bytes);

        assertThat(slash.reference()).isNotEqualTo(underscore.reference());
        assertThat(Files.exists(Path.of(slash.reference()))).isTrue();
        assertThat(Files.exists(Path.of(underscore.reference()))).isTrue();
    }
}
