package com.filingsync.ingestion.config;

import com.filingsync.ingestion.domain.ComparisonField;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties implements InitializingBean {

    private String baseUrl = "https://www.sedarplus.ca";
    private String userAgent = "FilingSync/1.0 (research ingestion)";
    private boolean schedulerEnabled = false;
    private long schedulerFixedDelayMs = 3_600_000;

    private long requestIntervalMs = 1_000;
    private int maxConcurrentRequests = 3;
    private int requestTimeoutSeconds = 60;
    private int maxAttempts = 4;
    private long backoffBaseMs = 1_000;
    private long backoffMaxMs = 30_000;
    private int maxInMemoryMb = 64;

    private int pageSize = 5_000;
    private int maxPagesPerWindow = 50;
    private int historicalChunkDays = 30;
    private int overlapDays = 2;
    private int initialLookbackDays = 7;
    private int workerThreads = 4;
    private long runTimeoutSeconds = 3_600;

    private List<ComparisonField> comparisonFields = new ArrayList<>(List.of(ComparisonField.values()));
    private boolean honorAmendmentMarker = true;
    private boolean refreshIssuers = true;

    private int inlineContentMaxBytes = 262_144;
    private String contentStoragePath = "data/filings";
    private String exportCachePath;

    @Override
    public void afterPropertiesSet() {
        validate();
    }

    /**
     * Rejects unusable settings before any run can start.
     */
    public void validate() {
        Map<String, Long> positive = new LinkedHashMap<>();
        positive.put("request-interval-ms", requestIntervalMs);
        positive.put("max-concurrent-requests", (long) maxConcurrentRequests);
        positive.put("request-timeout-seconds", (long) requestTimeoutSeconds);
        positive.put("max-attempts", (long) maxAttempts);
        positive.put("backoff-base-ms", backoffBaseMs);
        positive.put("backoff-max-ms", backoffMaxMs);
        positive.put("max-in-memory-mb", (long) maxInMemoryMb);
        positive.put("page-size", (long) pageSize);
        positive.put("max-pages-per-window", (long) maxPagesPerWindow);
        positive.put("historical-chunk-days", (long) historicalChunkDays);
        positive.put("overlap-days", (long) overlapDays);
        positive.put("initial-lookback-days", (long) initialLookbackDays);
        positive.put("worker-threads", (long) workerThreads);
        positive.put("run-timeout-seconds", runTimeoutSeconds);
        positive.put("inline-content-max-bytes", (long) inlineContentMaxBytes);
        positive.put("scheduler-fixed-delay-ms", schedulerFixedDelayMs);

        List<String> problems = new ArrayList<>();
        positive.forEach((name, value) -> {
            if (value == null || value <= 0) {
                problems.add("ingestion." + name + " must be positive but was " + value);
            }
        });
        if (backoffMaxMs > 0 && backoffBaseMs > backoffMaxMs) {
            problems.add("ingestion.backoff-base-ms must not exceed ingestion.backoff-max-ms");
        }
        if (comparisonFields == null || comparisonFields.isEmpty()) {
            problems.add("ingestion.comparison-fields must name at least one field");
        }
        if (isBlank(baseUrl)) {
            problems.add("ingestion.base-url is required");
        }
        if (isBlank(contentStoragePath)) {
            problems.add("ingestion.content-storage-path is required");
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException(String.join("; ", problems));
        }
    }

    public Set<ComparisonField> comparisonFieldSet() {
        return comparisonFields == null || comparisonFields.isEmpty()
            ? EnumSet.noneOf(ComparisonField.class)
            : EnumSet.copyOf(comparisonFields);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }

    public long getSchedulerFixedDelayMs() {
        return schedulerFixedDelayMs;
    }

    public void setSchedulerFixedDelayMs(long schedulerFixedDelayMs) {
        this.schedulerFixedDelayMs = schedulerFixedDelayMs;
    }

    public long getRequestIntervalMs() {
        return requestIntervalMs;
    }

    public void setRequestIntervalMs(long requestIntervalMs) {
        this.requestIntervalMs = requestIntervalMs;
    }

    public int getMaxConcurrentRequests() {
        return maxConcurrentRequests;
    }

    public void setMaxConcurrentRequests(int maxConcurrentRequests) {
        this.maxConcurrentRequests = maxConcurrentRequests;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public void setBackoffBaseMs(long backoffBaseMs) {
        this.backoffBaseMs = backoffBaseMs;
    }

    public long getBackoffMaxMs() {
        return backoffMaxMs;
    }

    public void setBackoffMaxMs(long backoffMaxMs) {
        this.backoffMaxMs = backoffMaxMs;
    }

    public int getMaxInMemoryMb() {
        return maxInMemoryMb;
    }

    public void setMaxInMemoryMb(int maxInMemoryMb) {
        this.maxInMemoryMb = maxInMemoryMb;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public int getMaxPagesPerWindow() {
        return maxPagesPerWindow;
    }

    public void setMaxPagesPerWindow(int maxPagesPerWindow) {
        this.maxPagesPerWindow = maxPagesPerWindow;
    }

    public int getHistoricalChunkDays() {
        return historicalChunkDays;
    }

    public void setHistoricalChunkDays(int historicalChunkDays) {
        this.historicalChunkDays = historicalChunkDays;
    }

    public int getOverlapDays() {
        return overlapDays;
    }

    public void setOverlapDays(int overlapDays) {
        this.overlapDays = overlapDays;
    }

    public int getInitialLookbackDays() {
        return initialLookbackDays;
    }

    public void setInitialLookbackDays(int initialLookbackDays) {
        this.initialLookbackDays = initialLookbackDays;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public long getRunTimeoutSeconds() {
        return runTimeoutSeconds;
    }

    public void setRunTimeoutSeconds(long runTimeoutSeconds) {
        this.runTimeoutSeconds = runTimeoutSeconds;
    }

    public List<ComparisonField> getComparisonFields() {
        return comparisonFields;
    }

    public void setComparisonFields(List<ComparisonField> comparisonFields) {
        this.comparisonFields = comparisonFields;
    }

    public boolean isHonorAmendmentMarker() {
        return honorAmendmentMarker;
    }

    public void setHonorAmendmentMarker(boolean honorAmendmentMarker) {
        this.honorAmendmentMarker = honorAmendmentMarker;
    }

    public boolean isRefreshIssuers() {
        return refreshIssuers;
    }

    public void setRefreshIssuers(boolean refreshIssuers) {
        this.refreshIssuers = refreshIssuers;
    }

    public int getInlineContentMaxBytes() {
        return inlineContentMaxBytes;
    }

    public void setInlineContentMaxBytes(int inlineContentMaxBytes) {
        this.inlineContentMaxBytes = inlineContentMaxBytes;
    }

    public String getContentStoragePath() {
        return contentStoragePath;
    }

    public void setContentStoragePath(String contentStoragePath) {
        this.contentStoragePath = contentStoragePath;
    }

    /**
     * Directory for copies of the raw CSV exports. Blank disables the copies.
     */
    public String getExportCachePath() {
        return exportCachePath;
    }

    public void setExportCachePath(String exportCachePath) {
        this.exportCachePath = exportCachePath;
    }
}
