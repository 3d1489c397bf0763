package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.concurrent.CancelToken;
import com.delta.catalogcrawler.crawl.concurrent.ConcurrencyPool;
import com.delta.catalogcrawler.crawl.fetch.CrawlException;
import com.delta.catalogcrawler.crawl.fetch.FetchCapability;
import com.delta.catalogcrawler.crawl.fetch.SiteTotalsCache;
import com.delta.catalogcrawler.crawl.gap.GapCollector;
import com.delta.catalogcrawler.crawl.gap.GapDetector;
import com.delta.catalogcrawler.crawl.model.CrawlRunRequest;
import com.delta.catalogcrawler.crawl.model.CrawlRunSummary;
import com.delta.catalogcrawler.crawl.model.CrawlRunView;
import com.delta.catalogcrawler.crawl.model.CrawlStatusSummary;
import com.delta.catalogcrawler.crawl.model.DetailCollectionResult;
import com.delta.catalogcrawler.crawl.model.FailedUnitReport;
import com.delta.catalogcrawler.crawl.model.GapCollectionOptions;
import com.delta.catalogcrawler.crawl.model.GapCollectionResult;
import com.delta.catalogcrawler.crawl.model.GapReport;
import com.delta.catalogcrawler.crawl.model.ListCollectionResult;
import com.delta.catalogcrawler.crawl.model.PageRange;
import com.delta.catalogcrawler.crawl.model.SaveResult;
import com.delta.catalogcrawler.crawl.model.SiteTotalsSnapshot;
import com.delta.catalogcrawler.crawl.persistence.CatalogJdbcRepository;
import com.delta.catalogcrawler.crawl.progress.CrawlEventListener;
import com.delta.catalogcrawler.crawl.progress.GapReportEvent;
import com.delta.catalogcrawler.crawl.progress.ProgressAggregator;
import com.delta.catalogcrawler.crawl.progress.ProgressSnapshot;
import com.delta.catalogcrawler.crawl.progress.RecordsSavedEvent;
import com.delta.catalogcrawler.crawl.stage.DetailCollectionStage;
import com.delta.catalogcrawler.crawl.stage.ListCollectionStage;
import com.delta.catalogcrawler.crawl.util.PageIndexMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the listing and detail stages for one crawl run at a time and exposes the gap pipeline.
 */
@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);
    private static final String DEFAULT_STOP_REASON = "user_request";

    private final CatalogJdbcRepository repository;
    private final FetchCapability fetchCapability;
    private final ConcurrencyPool concurrencyPool;
    private final GapDetector gapDetector;
    private final GapCollector gapCollector;
    private final ProgressAggregator progressAggregator;
    private final ExecutorService crawlRunExecutor;
    private final CrawlerProperties properties;
    private final Clock clock;
    private final SiteTotalsCache totalsCache;
    private final PageIndexMapper mapper;
    private final AtomicReference<ActiveRun> activeRun = new AtomicReference<>();

    public CrawlOrchestratorService(
        CatalogJdbcRepository repository,
        FetchCapability fetchCapability,
        ConcurrencyPool concurrencyPool,
        GapDetector gapDetector,
        GapCollector gapCollector,
        ProgressAggregator progressAggregator,
        @Qualifier("crawlRunExecutor") ExecutorService crawlRunExecutor,
        CrawlerProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.fetchCapability = fetchCapability;
        this.concurrencyPool = concurrencyPool;
        this.gapDetector = gapDetector;
        this.gapCollector = gapCollector;
        this.progressAggregator = progressAggregator;
        this.crawlRunExecutor = crawlRunExecutor;
        this.properties = properties;
        this.clock = clock;
        this.totalsCache = new SiteTotalsCache(
            Duration.ofSeconds(properties.getTotals().getCacheTtlSeconds()),
            properties.getTotals().getMaxAttempts(),
            Duration.ofMillis(properties.getTotals().getRetryDelayMs()),
            clock
        );
        this.mapper = new PageIndexMapper(properties.getCatalog().getPageSize());
    }

    public CrawlRunSummary run(CrawlRunRequest request) {
        ActiveRun run = claimRun();
        return runWithId(run, request);
    }

    public long startAsync(CrawlRunRequest request) {
        ActiveRun run = claimRun();
        try {
            crawlRunExecutor.submit(() -> runWithId(run, request));
        } catch (RuntimeException e) {
            activeRun.compareAndSet(run, null);
            repository.completeCrawlRun(run.crawlRunId(), clock.instant(), "FAILED", "submit_failed", 0, 0, 0);
            throw e;
        }
        return run.crawlRunId();
    }

    public boolean stop(String reason) {
        ActiveRun run = activeRun.get();
        if (run == null) {
            return false;
        }
        String effective = reason == null || reason.isBlank() ? DEFAULT_STOP_REASON : reason;
        boolean cancelled = run.token().cancel(effective);
        if (cancelled) {
            log.info("Crawl run {} stop requested: {}", run.crawlRunId(), effective);
        }
        return true;
    }

    public Long activeRunId() {
        ActiveRun run = activeRun.get();
        return run == null ? null : run.crawlRunId();
    }

    public CrawlStatusSummary checkStatus() {
        SiteTotalsSnapshot totals = totalsCache.get(fetchCapability, CancelToken.create());
        long stored = repository.totalRecordCount();
        long siteRecords = (long) (totals.totalPages() - 1) * mapper.pageSize()
            + mapper.boundaryPageCount(totals.lastPageRecordCount());
        int pageLimit = properties.getList().getPageLimit();
        PageRange range = ListCollectionStage.computeRange(totals, pageLimit, stored, mapper);
        int selectedPages = range == null ? 0 : range.size();
        return new CrawlStatusSummary(
            stored,
            totals.totalPages(),
            totals.lastPageRecordCount(),
            siteRecords,
            siteRecords - stored,
            range != null,
            range,
            selectedPages,
            (long) selectedPages * mapper.pageSize(),
            (long) selectedPages * properties.getRun().getEstimatedMsPerPage(),
            activeRunId(),
            clock.instant()
        );
    }

    public void invalidateTotals() {
        totalsCache.invalidate();
    }

    public GapReport detectGaps() {
        CancelToken token = CancelToken.create();
        GapReport report = gapDetector.detect(() -> totalsCache.get(fetchCapability, token));
        publishReport(report);
        return report;
    }

    public GapReport detectGaps(int startPageId, int endPageId) {
        CancelToken token = CancelToken.create();
        GapReport report = gapDetector.detectInRange(
            startPageId,
            endPageId,
            () -> totalsCache.get(fetchCapability, token)
        );
        publishReport(report);
        return report;
    }

    public GapCollectionResult collectGaps(GapCollectionOptions options) {
        ActiveRun run = claimRun();
        try {
            GapReport report = detectGaps();
            if (report.isComplete()) {
                finishRun(run, "COMPLETED", "no_gaps", 0, 0, 0);
                return GapCollectionResult.empty();
            }
            GapCollectionResult result = gapCollector.collect(report, fetchCapability, options, run.token(), listener());
            finishRun(
                run,
                gapStatus(result),
                "gaps collected=" + result.collected() + " skipped=" + result.skipped() + " failed=" + result.failed(),
                result.pageOutcomes().size(),
                result.pageOutcomes().size() - result.failedPageIds().size(),
                result.collected()
            );
            return result;
        } catch (RuntimeException e) {
            finishRun(run, "FAILED", "exception=" + e.getClass().getSimpleName(), 0, 0, 0);
            throw e;
        }
    }

    public GapCollectionResult collectPageGap(int pageId, GapCollectionOptions options) {
        if (pageId < 0) {
            throw new IllegalArgumentException("pageId must not be negative: " + pageId);
        }
        ActiveRun run = claimRun();
        try {
            GapReport report = detectGaps(pageId, pageId);
            GapCollectionResult result = gapCollector.collectPage(report, pageId, fetchCapability, options, run.token(), listener());
            finishRun(
                run,
                gapStatus(result),
                "gap pageId=" + pageId + " collected=" + result.collected(),
                result.pageOutcomes().size(),
                result.pageOutcomes().size() - result.failedPageIds().size(),
                result.collected()
            );
            return result;
        } catch (RuntimeException e) {
            finishRun(run, "FAILED", "exception=" + e.getClass().getSimpleName(), 0, 0, 0);
            throw e;
        }
    }

    public List<CrawlRunView> recentRuns(int limit) {
        return repository.findRecentCrawlRuns(Math.max(1, Math.min(limit, 200)));
    }

    public List<FailedUnitReport> failedPages(long crawlRunId) {
        return repository.findFailedPages(crawlRunId);
    }

    public ProgressSnapshot latestProgress() {
        return progressAggregator.latest();
    }

    private CrawlRunSummary runWithId(ActiveRun run, CrawlRunRequest request) {
        long crawlRunId = run.crawlRunId();
        Instant startedAt = run.startedAt();
        CancelToken token = run.token();
        String status = "FAILED";
        String notes = "crawl_failed";
        ListCollectionResult listResult = null;
        DetailCollectionResult detailResult = DetailCollectionResult.empty();
        SaveResult saved = SaveResult.empty();
        List<FailedUnitReport> failedPages = new ArrayList<>();

        int pageLimit = request == null || request.pageLimit() == null
            ? properties.getList().getPageLimit()
            : Math.max(0, request.pageLimit());
        boolean collectDetails = request == null || request.collectDetails() == null
            ? properties.getDetail().isEnabled()
            : request.collectDetails();

        try {
            ListCollectionStage listStage = new ListCollectionStage(
                fetchCapability,
                concurrencyPool,
                totalsCache,
                repository,
                mapper,
                properties.getList(),
                clock,
                listener()
            );
            listResult = listStage.collect(pageLimit, token);
            failedPages.addAll(listResult.failedPages());

            if (!listResult.records().isEmpty() && properties.getRun().isAutoSave()) {
                saved = saved.plus(repository.save(listResult.records()));
                progressAggregator.publish(new RecordsSavedEvent(crawlRunId, "records", saved, clock.instant()));
            }

            if (listResult.isEmptyRange()) {
                status = "COMPLETED";
                notes = "up_to_date";
            } else if (listResult.cancelled()) {
                status = "ABORTED";
                notes = "cancelled: " + token.reason();
            } else if (listResult.stageFailed()) {
                status = "FAILED";
                notes = "list_stage_failed pages=" + listResult.failedPages().size();
            } else {
                if (collectDetails) {
                    DetailCollectionStage detailStage = new DetailCollectionStage(
                        fetchCapability,
                        concurrencyPool,
                        properties.getDetail(),
                        clock,
                        listener()
                    );
                    detailResult = detailStage.collect(listResult.records(), token);
                    if (!detailResult.details().isEmpty() && properties.getRun().isAutoSave()) {
                        SaveResult detailSaved = repository.saveDetails(detailResult.details());
                        progressAggregator.publish(new RecordsSavedEvent(crawlRunId, "details", detailSaved, clock.instant()));
                    }
                }
                if (detailResult.cancelled()) {
                    status = "ABORTED";
                    notes = "cancelled: " + token.reason();
                } else if (!detailResult.failedRecords().isEmpty()) {
                    status = "COMPLETED_WITH_ERRORS";
                    notes = "records=" + listResult.records().size() + " detail_failures=" + detailResult.failedRecords().size();
                } else {
                    status = "COMPLETED";
                    notes = "records=" + listResult.records().size();
                }
            }
        } catch (CrawlException e) {
            if (e.isAborted()) {
                log.info("Crawl run {} aborted: {}", crawlRunId, e.getMessage());
                status = "ABORTED";
            } else {
                log.warn("Crawl run {} failed: {} {}", crawlRunId, e.kind(), e.getMessage());
                status = "FAILED";
            }
            notes = e.kind() + ": " + e.getMessage();
        } catch (Exception e) {
            log.warn("Crawl run {} failed", crawlRunId, e);
            status = "FAILED";
            notes = "exception=" + e.getClass().getSimpleName();
        }

        Instant finishedAt = clock.instant();
        int attempted = listResult == null ? 0 : listResult.attemptedUnits();
        int succeeded = listResult == null ? 0 : listResult.succeededUnits();
        int records = listResult == null ? 0 : listResult.records().size();
        try {
            repository.insertFailedPages(crawlRunId, failedPages);
        } finally {
            repository.completeCrawlRun(crawlRunId, finishedAt, status, notes, attempted, succeeded, records);
            activeRun.compareAndSet(run, null);
        }
        log.info(
            "Crawl run {} finished with status {}: pages {}/{} records={} saved={} details={}",
            crawlRunId,
            status,
            succeeded,
            attempted,
            records,
            saved,
            detailResult.details().size()
        );
        return new CrawlRunSummary(
            crawlRunId,
            startedAt,
            finishedAt,
            status,
            notes,
            listResult == null ? null : listResult.range(),
            attempted,
            succeeded,
            listResult == null ? 0.0 : listResult.successRate(),
            records,
            detailResult.details().size(),
            detailResult.failedRecords().size(),
            saved,
            failedPages
        );
    }

    private ActiveRun claimRun() {
        ActiveRun current = activeRun.get();
        if (current != null) {
            throw activeRunConflict(current);
        }
        Instant startedAt = clock.instant();
        ActiveRun candidate = new ActiveRun(-1L, startedAt, CancelToken.create());
        if (!activeRun.compareAndSet(null, candidate)) {
            throw activeRunConflict(activeRun.get());
        }
        try {
            long crawlRunId = repository.insertCrawlRun(startedAt, "RUNNING", "crawl started");
            ActiveRun run = new ActiveRun(crawlRunId, startedAt, candidate.token());
            activeRun.set(run);
            return run;
        } catch (RuntimeException e) {
            activeRun.compareAndSet(candidate, null);
            throw e;
        }
    }

    private void finishRun(ActiveRun run, String status, String notes, int attempted, int succeeded, int records) {
        try {
            repository.completeCrawlRun(run.crawlRunId(), clock.instant(), status, notes, attempted, succeeded, records);
        } finally {
            activeRun.compareAndSet(run, null);
        }
    }

    private static ActiveCrawlRunException activeRunConflict(ActiveRun run) {
        if (run == null) {
            return new ActiveCrawlRunException(null, null);
        }
        return new ActiveCrawlRunException(run.crawlRunId() < 0 ? null : run.crawlRunId(), run.startedAt());
    }

    private static String gapStatus(GapCollectionResult result) {
        if (result.cancelled()) {
            return "ABORTED";
        }
        return result.failedPageIds().isEmpty() ? "COMPLETED" : "COMPLETED_WITH_ERRORS";
    }

    private void publishReport(GapReport report) {
        gapDetector.logReport(report);
        progressAggregator.publish(new GapReportEvent(
            report.missingPages().size(),
            report.totalMissingRecords(),
            report.crawlingRanges().size(),
            report.completionPercentage(),
            report.totalsFromFallback(),
            clock.instant()
        ));
    }

    private CrawlEventListener listener() {
        return progressAggregator::publish;
    }

    private record ActiveRun(long crawlRunId, Instant startedAt, CancelToken token) {
    }
}
