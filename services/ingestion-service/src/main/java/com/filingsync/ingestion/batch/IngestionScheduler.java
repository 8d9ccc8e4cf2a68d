package com.filingsync.ingestion.batch;

import com.filingsync.ingestion.config.IngestionProperties;
import com.filingsync.ingestion.domain.RunSummary;
import com.filingsync.ingestion.service.ActiveRunException;
import com.filingsync.ingestion.service.ReconciliationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class IngestionScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestionScheduler.class);

    private final IngestionProperties properties;
    private final ReconciliationEngine reconciliationEngine;

    public IngestionScheduler(IngestionProperties properties, ReconciliationEngine reconciliationEngine) {
        this.properties = properties;
        this.reconciliationEngine = reconciliationEngine;
    }

    @Scheduled(
        initialDelayString = "${ingestion.scheduler-fixed-delay-ms:3600000}",
        fixedDelayString = "${ingestion.scheduler-fixed-delay-ms:3600000}"
    )
    public void runScheduledIngestion() {
        if (!properties.isSchedulerEnabled()) {
            return;
        }
        try {
            RunSummary summary = reconciliationEngine.runIncremental(null);
            LOGGER.info("Scheduled incremental run {} finished with status {}", summary.runId(), summary.status());
        } catch (ActiveRunException ex) {
            LOGGER.info("Skipping scheduled run: {}", ex.getMessage());
        }
    }
}
