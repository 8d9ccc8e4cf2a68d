package com.filingsync.ingestion.service;

import com.filingsync.ingestion.client.ContentStore;
import com.filingsync.ingestion.client.FetchException;
import com.filingsync.ingestion.client.FetchedContent;
import com.filingsync.ingestion.client.PermanentFetchException;
import com.filingsync.ingestion.client.PortalClient;
import com.filingsync.ingestion.client.PortalPage;
import com.filingsync.ingestion.config.IngestionProperties;
import com.filingsync.ingestion.domain.ContentLocation;
import com.filingsync.ingestion.domain.Decision;
import com.filingsync.ingestion.domain.FailureCode;
import com.filingsync.ingestion.domain.FetchWindow;
import com.filingsync.ingestion.domain.FilingEntity;
import com.filingsync.ingestion.domain.IngestionFailureEntity;
import com.filingsync.ingestion.domain.IssuerRecord;
import com.filingsync.ingestion.domain.ObservedFiling;
import com.filingsync.ingestion.domain.RunLedgerEntity;
import com.filingsync.ingestion.domain.RunMode;
import com.filingsync.ingestion.domain.RunSummary;
import com.filingsync.ingestion.sink.FilingSink;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives one pipeline run through
 * {@code INITIALIZING -> FETCHING -> CLASSIFYING -> PERSISTING -> FINALIZING}.
 *
 * <p>Metadata fetch failures abort the run. Content failures and sink write failures are recorded
 * per record and the run carries on. Filing rows the portal returned but that could not be read are
 * recorded as {@code MALFORMED_ROW}; the readable rows are still persisted, but the run ends FAILED
 * so the window is fetched again. Only a completed incremental run moves the watermark, because the
 * watermark is read back from completed ledger entries.
 */
@Service
public class ReconciliationEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationEngine.class);

    private static final int MAX_REASON = 400;

    enum RunState {
        INITIALIZING,
        FETCHING,
        CLASSIFYING,
        PERSISTING,
        FINALIZING
    }

    private final PortalClient portalClient;
    private final IdentityResolver identityResolver;
    private final FilingSink filingSink;
    private final ContentStore contentStore;
    private final JobLedger jobLedger;
    private final IngestionProperties properties;
    private final ExecutorService ingestionExecutor;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ConcurrentHashMap<UUID, RunContext> activeRuns = new ConcurrentHashMap<>();

    public ReconciliationEngine(
        PortalClient portalClient,
        IdentityResolver identityResolver,
        FilingSink filingSink,
        ContentStore contentStore,
        JobLedger jobLedger,
        IngestionProperties properties,
        @Qualifier("ingestionExecutor") ExecutorService ingestionExecutor,
        Clock clock
    ) {
        this.portalClient = portalClient;
        this.identityResolver = identityResolver;
        this.filingSink = filingSink;
        this.contentStore = contentStore;
        this.jobLedger = jobLedger;
        this.properties = properties;
        this.ingestionExecutor = ingestionExecutor;
        this.clock = clock;
    }

    /**
     * Reconciles {@code [watermark - overlapDays, today]}. Without a previous completed incremental
     * run the window starts {@code initialLookbackDays} ago.
     */
    public RunSummary runIncremental(Integer overlapDays) {
        int overlap = overlapDays == null ? properties.getOverlapDays() : overlapDays;
        if (overlap < 0) {
            throw new IllegalArgumentException("overlapDays must not be negative: " + overlap);
        }
        FetchWindow window = incrementalWindow(jobLedger.latestSuccessfulWatermark(), overlap, LocalDate.now(clock));
        return execute(RunMode.INCREMENTAL, window, window.split(properties.getHistoricalChunkDays()));
    }

    public RunSummary runHistorical(LocalDate start, LocalDate end, Integer chunkDays) {
        int chunk = chunkDays == null ? properties.getHistoricalChunkDays() : chunkDays;
        FetchWindow window = new FetchWindow(start, end);
        return execute(RunMode.HISTORICAL, window, window.split(chunk));
    }

    /**
     * Flags a running run for cancellation. It stops at the next state boundary.
     */
    public boolean cancel(UUID runId) {
        RunContext context = activeRuns.get(runId);
        if (context == null) {
            return false;
        }
        context.cancelled = true;
        LOGGER.info("Cancellation requested for run {}", runId);
        return true;
    }

    public Optional<RunSummary> getRun(UUID runId) {
        return jobLedger.find(runId).map(RunSummary::from);
    }

    public List<IngestionFailureEntity> getRunFailures(UUID runId) {
        return jobLedger.recentFailures(runId);
    }

    FetchWindow incrementalWindow(Optional<LocalDate> watermark, int overlapDays, LocalDate today) {
        LocalDate start = watermark
            .map(mark -> mark.minusDays(overlapDays))
            .orElseGet(() -> today.minusDays(properties.getInitialLookbackDays()));
        if (start.isAfter(today)) {
            start = today;
        }
        return new FetchWindow(start, today);
    }

    private RunSummary execute(RunMode mode, FetchWindow window, List<FetchWindow> chunks) {
        if (!running.compareAndSet(false, true)) {
            throw new ActiveRunException("Another ingestion run is in progress");
        }
        try {
            RunLedgerEntity run = jobLedger.create(mode, window, clock.instant());
            RunContext context = new RunContext(run, clock.instant().plusSeconds(properties.getRunTimeoutSeconds()));
            activeRuns.put(run.getRunId(), context);
            try {
                return reconcile(context, chunks);
            } finally {
                activeRuns.remove(run.getRunId());
            }
        } finally {
            running.set(false);
        }
    }

    private RunSummary reconcile(RunContext context, List<FetchWindow> chunks) {
        RunLedgerEntity run = context.run;
        RunState state = RunState.INITIALIZING;
        LOGGER.info("Run {} ({}) started for window {} in {} chunk(s)",
            run.getRunId(), run.getMode(), run.window(), chunks.size());
        try {
            state = advance(context, state, RunState.FETCHING);
            FetchedRows fetched = fetchAll(context, chunks);
            List<ObservedFiling> observed = fetched.records();
            run.addSeen(observed.size() + fetched.rejected().size());
            recordRejectedRows(context, fetched.rejected());
            List<IssuerRecord> issuers = refreshIssuers(context);
            jobLedger.update(run);

            state = advance(context, state, RunState.CLASSIFYING);
            List<FilingIntent> intents = classify(context, observed);

            state = advance(context, state, RunState.PERSISTING);
            persistIssuers(context, mergeIssuers(issuers, observed));
            persistIntents(context, intents);
            jobLedger.update(run);

            state = advance(context, state, RunState.FINALIZING);
            if (!fetched.rejected().isEmpty()) {
                return failRun(context, fetched.rejected().size() + " filing row(s) could not be read");
            }
            run.complete(clock.instant(), context.issueSummary());
            RunLedgerEntity finalized = jobLedger.finalizeRun(run);
            LOGGER.info("Run {} completed: seen={}, new={}, superseded={}, failed={}, errored={}",
                run.getRunId(), run.getRecordsSeen(), run.getRecordsNew(), run.getRecordsSuperseded(),
                run.getRecordsFailed(), run.getRecordsErrored());
            return RunSummary.from(finalized);
        } catch (RunCancelledException ex) {
            return failRun(context, "cancelled during " + state + ": " + ex.getMessage());
        } catch (FetchException ex) {
            return failRun(context, "metadata fetch failed during " + state + ": " + ex.getMessage());
        } catch (LedgerWriteException ex) {
            LOGGER.error("Run {} aborted, ledger is not writable", run.getRunId(), ex);
            throw ex;
        } catch (RuntimeException ex) {
            LOGGER.error("Run {} failed during {}", run.getRunId(), state, ex);
            return failRun(context, "unexpected error during " + state + ": " + ex);
        }
    }

    private RunState advance(RunContext context, RunState from, RunState to) {
        context.checkCancelled(clock);
        LOGGER.debug("Run {} {} -> {}", context.run.getRunId(), from, to);
        return to;
    }

    private RunSummary failRun(RunContext context, String detail) {
        RunLedgerEntity run = context.run;
        String summary = context.issueSummary();
        run.fail(clock.instant(), summary == null ? detail : detail + " | " + summary);
        LOGGER.warn("Run {} failed: {}", run.getRunId(), detail);
        return RunSummary.from(jobLedger.finalizeRun(run));
    }

    // Fetching

    private FetchedRows fetchAll(RunContext context, List<FetchWindow> chunks) {
        List<Future<FetchedRows>> futures = new ArrayList<>();
        for (FetchWindow chunk : chunks) {
            futures.add(submit(context, () -> fetchWindow(context, chunk)));
        }
        List<ObservedFiling> observed = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        for (FetchedRows chunkRows : awaitAll(context, futures)) {
            observed.addAll(chunkRows.records());
            rejected.addAll(chunkRows.rejected());
        }
        LOGGER.info("Run {} fetched {} filing rows, {} unreadable", context.run.getRunId(), observed.size(), rejected.size());
        return new FetchedRows(observed, rejected);
    }

    private FetchedRows fetchWindow(RunContext context, FetchWindow chunk) {
        List<ObservedFiling> records = new ArrayList<>();
        List<String> rejected = new ArrayList<>();
        int maxPages = properties.getMaxPagesPerWindow();
        int pages = 0;
        String pageToken = null;
        do {
            if (pages >= maxPages) {
                throw new PermanentFetchException("search " + chunk, 0,
                    "pagination did not terminate within " + maxPages + " pages");
            }
            context.checkCancelled(clock);
            PortalPage<ObservedFiling> page = portalClient.search(chunk, pageToken);
            pages++;
            records.addAll(page.records());
            page.rejectedRows().forEach(row -> rejected.add(chunk + " " + row));
            pageToken = page.nextPageToken();
        } while (pageToken != null);
        LOGGER.debug("Window {} returned {} rows over {} page(s)", chunk, records.size(), pages);
        return new FetchedRows(records, rejected);
    }

    private void recordRejectedRows(RunContext context, List<String> rejected) {
        for (String row : rejected) {
            context.run.incrementErrored();
            recordIssue(context, null, FailureCode.MALFORMED_ROW, row);
        }
    }

    private List<IssuerRecord> refreshIssuers(RunContext context) {
        if (!properties.isRefreshIssuers()) {
            return List.of();
        }
        List<IssuerRecord> issuers = new ArrayList<>();
        try {
            String pageToken = null;
            int pages = 0;
            do {
                if (pages >= properties.getMaxPagesPerWindow()) {
                    throw new PermanentFetchException("issuers", 0,
                        "pagination did not terminate within " + properties.getMaxPagesPerWindow() + " pages");
                }
                PortalPage<IssuerRecord> page = portalClient.fetchIssuers(pageToken);
                pages++;
                issuers.addAll(page.records());
                pageToken = page.nextPageToken();
            } while (pageToken != null);
            return issuers;
        } catch (FetchException ex) {
            LOGGER.warn("Run {} could not refresh issuers: {}", context.run.getRunId(), ex.getMessage());
            recordIssue(context, null, FailureCode.ISSUER_REFRESH_ERROR, ex.getMessage());
            return List.of();
        }
    }

    // Classifying

    private List<FilingIntent> classify(RunContext context, List<ObservedFiling> observed) {
        Map<String, ObservedFiling> latest = identityResolver.collapse(observed);
        List<Resolution> actionable = new ArrayList<>();
        int duplicates = 0;
        for (ObservedFiling filing : latest.values()) {
            Resolution resolution = identityResolver.resolve(filing, filingSink.findHistory(filing.documentIdentity()));
            if (!resolution.decision().requiresContent()) {
                duplicates++;
                continue;
            }
            LOGGER.debug("{} -> {} v{} ({})", filing.documentIdentity(), resolution.decision(),
                resolution.version(), resolution.reason());
            actionable.add(resolution);
        }
        LOGGER.info("Run {} classified {} identities: {} actionable, {} unchanged",
            context.run.getRunId(), latest.size(), actionable.size(), duplicates);

        List<Future<FilingIntent>> futures = new ArrayList<>();
        for (Resolution resolution : actionable) {
            futures.add(submit(context, () -> fetchContent(context, resolution)));
        }
        return awaitAll(context, futures);
    }

    private FilingIntent fetchContent(RunContext context, Resolution resolution) {
        context.checkCancelled(clock);
        ObservedFiling observed = resolution.observed();
        FilingEntity record = FilingEntity.fromObservation(observed, resolution.version());
        record.setSupersedes(resolution.supersedesId());
        try {
            FetchedContent content = portalClient.downloadContent(observed);
            ContentLocation location = contentStore.put(observed.documentIdentity(), content.bytes());
            record.attachContent(location, content.sha256(), content.sizeMismatch());
            FilingIntent.FetchedLength sizeCheck = content.sizeMismatch()
                ? new FilingIntent.FetchedLength(content.declaredSize(), content.length())
                : null;
            return FilingIntent.ready(resolution, record, sizeCheck);
        } catch (FetchException ex) {
            String reason = truncate(ex.getMessage());
            record.markFailed(reason);
            return FilingIntent.contentFailed(resolution, record, reason);
        } catch (IllegalStateException ex) {
            String reason = truncate("content store: " + ex.getMessage());
            record.markFailed(reason);
            return FilingIntent.contentFailed(resolution, record, reason);
        }
    }

    // Persisting

    private List<IssuerRecord> mergeIssuers(List<IssuerRecord> exported, List<ObservedFiling> observed) {
        Instant now = clock.instant();
        Map<String, IssuerRecord> byId = new LinkedHashMap<>();
        for (ObservedFiling filing : observed) {
            byId.put(filing.issuerId(), IssuerRecord.seenInFiling(filing.issuerId(), filing.issuerName(), now));
        }
        for (IssuerRecord issuer : exported) {
            byId.put(issuer.issuerId(), issuer.observedAt(now));
        }
        return new ArrayList<>(byId.values());
    }

    private void persistIssuers(RunContext context, List<IssuerRecord> issuers) {
        for (IssuerRecord issuer : issuers) {
            try {
                filingSink.upsertIssuer(issuer);
            } catch (RuntimeException ex) {
                context.run.incrementErrored();
                recordIssue(context, issuer.issuerId(), FailureCode.SINK_WRITE_ERROR, ex.getMessage());
            }
        }
    }

    private void persistIntents(RunContext context, List<FilingIntent> intents) {
        RunLedgerEntity run = context.run;
        for (FilingIntent intent : intents) {
            try {
                apply(intent);
            } catch (RuntimeException ex) {
                LOGGER.warn("Sink write failed for {}: {}", intent.documentIdentity(), ex.getMessage());
                run.incrementErrored();
                recordIssue(context, intent.documentIdentity(), FailureCode.SINK_WRITE_ERROR, ex.getMessage());
                continue;
            }

            if (intent.isContentFailed()) {
                run.incrementFailed();
                recordIssue(context, intent.documentIdentity(), FailureCode.CONTENT_FETCH_ERROR, intent.failureReason());
                continue;
            }
            Decision decision = intent.resolution().decision();
            if (decision == Decision.AMENDMENT) {
                run.incrementSuperseded();
            } else {
                run.incrementNew();
                if (decision == Decision.RETRY) {
                    run.incrementRetried();
                    if (intent.resolution().supersedesId() != null) {
                        run.incrementSuperseded();
                    }
                }
            }
            if (intent.hasSizeMismatch()) {
                run.incrementSizeMismatches();
                recordIssue(context, intent.documentIdentity(), FailureCode.SIZE_MISMATCH,
                    "declared " + intent.sizeCheck().declared() + " bytes, fetched " + intent.sizeCheck().fetched());
            }
        }
    }

    private void apply(FilingIntent intent) {
        FilingEntity record = intent.record();
        if (intent.isContentFailed()) {
            filingSink.markFailed(record);
            return;
        }
        UUID supersedesId = intent.resolution().supersedesId();
        if (supersedesId != null) {
            filingSink.supersede(supersedesId, record);
        } else {
            filingSink.upsertFilingActive(record);
        }
    }

    // Helpers

    private void recordIssue(RunContext context, String documentIdentity, FailureCode code, String reason) {
        String safeReason = truncate(reason);
        jobLedger.recordFailure(context.run.getRunId(), documentIdentity, code, safeReason);
        context.issues.add(code + (documentIdentity == null ? "" : " " + documentIdentity) + ": " + safeReason);
    }

    private <T> Future<T> submit(RunContext context, Supplier<T> work) {
        return ingestionExecutor.submit(() -> {
            try {
                return work.get();
            } catch (RuntimeException ex) {
                context.firstWorkerFailure.compareAndSet(null, ex);
                throw ex;
            }
        });
    }

    /**
     * Waits for every worker, even after one has failed, so that no worker is still writing to the
     * content store once the run is finalized. The first worker failure aborts the remaining workers
     * at their next cancellation check and is the one rethrown.
     */
    private <T> List<T> awaitAll(RunContext context, List<Future<T>> futures) {
        List<T> results = new ArrayList<>(futures.size());
        RuntimeException failure = null;
        for (Future<T> future : futures) {
            try {
                results.add(await(future));
            } catch (RuntimeException ex) {
                if (failure == null) {
                    failure = ex;
                    context.firstWorkerFailure.compareAndSet(null, ex);
                } else {
                    LOGGER.debug("Run {} worker also failed: {}", context.run.getRunId(), ex.getMessage());
                }
            }
        }
        if (failure != null) {
            throw context.firstWorkerFailure.get();
        }
        return results;
    }

    private <T> T await(Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("interrupted while waiting for workers");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Worker failed", cause);
        }
    }

    private String truncate(String text) {
        if (text == null || text.isBlank()) {
            return "unknown";
        }
        return text.length() <= MAX_REASON ? text : text.substring(0, MAX_REASON);
    }

    private record FetchedRows(List<ObservedFiling> records, List<String> rejected) {
    }

    private static final class RunContext {

        private final RunLedgerEntity run;
        private final Instant deadline;
        private final List<String> issues = new ArrayList<>();
        private final AtomicReference<RuntimeException> firstWorkerFailure = new AtomicReference<>();
        private volatile boolean cancelled;

        private RunContext(RunLedgerEntity run, Instant deadline) {
            this.run = run;
            this.deadline = deadline;
        }

        private void checkCancelled(Clock clock) {
            if (cancelled) {
                throw new RunCancelledException("cancelled by operator");
            }
            if (firstWorkerFailure.get() != null) {
                throw new RunCancelledException("run aborted after a worker failure");
            }
            if (clock.instant().isAfter(deadline)) {
                throw new RunCancelledException("run timeout exceeded");
            }
        }

        private String issueSummary() {
            if (issues.isEmpty()) {
                return null;
            }
            return issues.size() + " issue(s): " + String.join("; ", issues);
        }
    }
}
