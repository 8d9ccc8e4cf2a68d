package com.filingsync.ingestion.client;

import com.filingsync.ingestion.config.IngestionProperties;
import com.filingsync.ingestion.domain.FetchWindow;
import com.filingsync.ingestion.domain.IssuerRecord;
import com.filingsync.ingestion.domain.ObservedFiling;
import java.net.URI;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Calls to the disclosure portal: the paginated CSV exports and document downloads. Every call
 * goes through the shared {@link RateLimiter} and the bounded retry loop.
 */
@Component
public class PortalClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(PortalClient.class);

    static final String EXPORT_PATH = "/csa-party/service/exportCsv";

    private final WebClient portalWebClient;
    private final RateLimiter rateLimiter;
    private final PortalCsvParser csvParser;
    private final ExportArchive exportArchive;
    private final IngestionProperties properties;

    public PortalClient(
        @Qualifier("portalWebClient") WebClient portalWebClient,
        RateLimiter rateLimiter,
        PortalCsvParser csvParser,
        ExportArchive exportArchive,
        IngestionProperties properties
    ) {
        this.portalWebClient = portalWebClient;
        this.rateLimiter = rateLimiter;
        this.csvParser = csvParser;
        this.exportArchive = exportArchive;
        this.properties = properties;
    }

    public PortalPage<ObservedFiling> search(FetchWindow window, String pageToken) {
        int start = startOffset(pageToken);
        int pageSize = properties.getPageSize();
        Map<String, Object> queryArgs = new LinkedHashMap<>();
        queryArgs.put("_locale", "en");
        queryArgs.put("fromDate", window.start().toString());
        queryArgs.put("toDate", window.end().toString());
        queryArgs.put("start", start);
        queryArgs.put("pageSize", pageSize);

        String operation = "search " + window + " start=" + start;
        String csv = execute(operation, () -> exportCsv("searchDocuments", queryArgs));
        exportArchive.saveFilings(window, start, csv);
        PortalCsvParser.Parsed<ObservedFiling> parsed = csvParser.parseFilings(csv);
        LOGGER.debug("{} returned {} rows", operation, parsed.rowCount());
        return new PortalPage<>(parsed.items(), nextToken(start, parsed.rowCount(), pageSize), parsed.rejected());
    }

    public PortalPage<IssuerRecord> fetchIssuers(String pageToken) {
        int start = startOffset(pageToken);
        int pageSize = properties.getPageSize();
        Map<String, Object> queryArgs = new LinkedHashMap<>();
        queryArgs.put("_locale", "en");
        queryArgs.put("start", start);
        queryArgs.put("pageSize", pageSize);

        String csv = execute("issuers start=" + start, () -> exportCsv("reportingIssuers", queryArgs));
        exportArchive.saveIssuers(start, csv);
        PortalCsvParser.Parsed<IssuerRecord> parsed = csvParser.parseIssuers(csv);
        return new PortalPage<>(parsed.items(), nextToken(start, parsed.rowCount(), pageSize));
    }

    public FetchedContent downloadContent(ObservedFiling filing) {
        String operation = "download " + filing.documentIdentity();
        if (filing.sourceUrl() == null || filing.sourceUrl().isBlank()) {
            throw new PermanentFetchException(operation, 0, "no content reference");
        }
        URI uri;
        try {
            uri = URI.create(filing.sourceUrl());
        } catch (IllegalArgumentException e) {
            throw new PermanentFetchException(operation, 0, "invalid content reference " + filing.sourceUrl(), e);
        }

        byte[] bytes = execute(operation, () -> portalWebClient.get()
            .uri(uri)
            .accept(MediaType.ALL)
            .retrieve()
            .bodyToMono(byte[].class)
            .block());
        if (bytes == null) {
            bytes = new byte[0];
        }

        Long declared = filing.sizeBytes();
        boolean mismatch = declared != null && declared >= 0 && declared != bytes.length;
        if (mismatch) {
            LOGGER.warn("Size mismatch for {}: declared {} bytes, fetched {}", filing.documentIdentity(), declared, bytes.length);
        }
        return new FetchedContent(bytes, sha256(bytes), declared, mismatch);
    }

    private String exportCsv(String service, Map<String, Object> queryArgs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("service", service);
        payload.put("queryArgs", queryArgs);
        return portalWebClient.post()
            .uri(EXPORT_PATH)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.ALL)
            .bodyValue(payload)
            .retrieve()
            .bodyToMono(String.class)
            .block();
    }

    private <T> T execute(String operation, Supplier<T> call) {
        RetryState state = RetryState.first(properties.getBackoffBaseMs(), properties.getBackoffMaxMs());
        while (true) {
            int lastStatus;
            String lastError;
            RuntimeException lastCause;
            try (RateLimiter.Permit permit = rateLimiter.acquire()) {
                return call.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientFetchException(operation, state.attempt(), 0, "interrupted", e);
            } catch (WebClientResponseException e) {
                int status = e.getStatusCode().value();
                if (e.getStatusCode().is2xxSuccessful()) {
                    throw new PermanentFetchException(operation, status, unreadableBody(e), e);
                }
                if (!isRetryable(status)) {
                    throw new PermanentFetchException(operation, status, "HTTP " + status, e);
                }
                lastStatus = status;
                lastError = "HTTP " + status;
                lastCause = e;
            } catch (WebClientRequestException e) {
                lastStatus = 0;
                lastError = e.getMostSpecificCause().getClass().getSimpleName();
                lastCause = e;
            }

            if (!state.canRetry(properties.getMaxAttempts())) {
                throw new TransientFetchException(operation, state.attempt(), lastStatus, lastError, lastCause);
            }
            LOGGER.warn("{} failed on attempt {} ({}), retrying in {} ms", operation, state.attempt(), lastError, state.nextDelayMs());
            sleep(operation, state);
            state = state.next();
        }
    }

    private void sleep(String operation, RetryState state) {
        try {
            Thread.sleep(state.nextDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientFetchException(operation, state.attempt(), 0, "interrupted during backoff", e);
        }
    }

    private String unreadableBody(WebClientResponseException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof DataBufferLimitException) {
                return "response larger than the " + properties.getMaxInMemoryMb() + " MB limit";
            }
        }
        return "unreadable response body: " + e.getMostSpecificCause().getMessage();
    }

    private boolean isRetryable(int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    private int startOffset(String pageToken) {
        if (pageToken == null || pageToken.isBlank()) {
            return 1;
        }
        try {
            int start = Integer.parseInt(pageToken.trim());
            if (start < 1) {
                throw new NumberFormatException("negative offset");
            }
            return start;
        } catch (NumberFormatException e) {
            throw new PermanentFetchException("pagination", 0, "invalid page token " + pageToken, e);
        }
    }

    private String nextToken(int start, int rowCount, int pageSize) {
        return rowCount >= pageSize ? String.valueOf(start + rowCount) : null;
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
