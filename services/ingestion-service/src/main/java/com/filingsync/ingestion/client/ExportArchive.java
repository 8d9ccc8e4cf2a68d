package com.filingsync.ingestion.client;

import com.filingsync.ingestion.config.IngestionProperties;
import com.filingsync.ingestion.domain.FetchWindow;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps a copy of each raw CSV export under {@code ingestion.export-cache-path}, so a run's input can
 * be inspected or replayed. Disabled when the path is blank. A copy that cannot be written is logged
 * and does not fail the fetch.
 */
@Component
public class ExportArchive {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExportArchive.class);

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private final IngestionProperties properties;
    private final Clock clock;

    public ExportArchive(IngestionProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public Optional<Path> saveFilings(FetchWindow window, int start, String csv) {
        return save("filings_" + window.start() + "_" + window.end() + "_" + start + ".csv", csv);
    }

    public Optional<Path> saveIssuers(int start, String csv) {
        return save("issuers_" + DAY.format(LocalDate.now(clock)) + "_" + start + ".csv", csv);
    }

    private Optional<Path> save(String fileName, String csv) {
        String cachePath = properties.getExportCachePath();
        if (cachePath == null || cachePath.isBlank() || csv == null) {
            return Optional.empty();
        }
        Path target = Path.of(cachePath).resolve(fileName);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, csv, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            LOGGER.debug("Archived export to {}", target);
            return Optional.of(target);
        } catch (IOException e) {
            LOGGER.warn("Could not archive export {}: {}", target, e.getMessage());
            return Optional.empty();
        }
    }
}
