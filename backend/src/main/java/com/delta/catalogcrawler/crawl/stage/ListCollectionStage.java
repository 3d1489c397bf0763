package com.delta.catalogcrawler.crawl.stage;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.concurrent.CancelToken;
import com.delta.catalogcrawler.crawl.concurrent.ConcurrencyPool;
import com.delta.catalogcrawler.crawl.fetch.CrawlException;
import com.delta.catalogcrawler.crawl.fetch.FetchCapability;
import com.delta.catalogcrawler.crawl.fetch.SiteTotalsCache;
import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.FailedUnitReport;
import com.delta.catalogcrawler.crawl.model.ListCollectionResult;
import com.delta.catalogcrawler.crawl.model.ListingPage;
import com.delta.catalogcrawler.crawl.model.ListingRecord;
import com.delta.catalogcrawler.crawl.model.PageRange;
import com.delta.catalogcrawler.crawl.model.PageSlot;
import com.delta.catalogcrawler.crawl.model.PageUnitStatus;
import com.delta.catalogcrawler.crawl.model.SiteTotalsSnapshot;
import com.delta.catalogcrawler.crawl.persistence.RecordStore;
import com.delta.catalogcrawler.crawl.progress.CrawlEventListener;
import com.delta.catalogcrawler.crawl.progress.RetryCycleEvent;
import com.delta.catalogcrawler.crawl.progress.StageSummaryEvent;
import com.delta.catalogcrawler.crawl.util.FetchErrorClassifier;
import com.delta.catalogcrawler.crawl.util.PageIndexMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stage one: fetches every listing page of the incremental range, then re-fetches only the incomplete pages.
 *
 * <p>Any page still unresolved after the retry budget fails the whole stage, since downstream position math
 * assumes the range was covered completely. One instance serves one run.
 */
public class ListCollectionStage {
    private static final Logger log = LoggerFactory.getLogger(ListCollectionStage.class);

    private final FetchCapability fetchCapability;
    private final ConcurrencyPool pool;
    private final SiteTotalsCache totalsCache;
    private final RecordStore recordStore;
    private final PageIndexMapper mapper;
    private final CrawlerProperties.ListStage settings;
    private final Clock clock;
    private final CrawlEventListener listener;
    private final Map<Integer, PageAccumulator> cache = new ConcurrentHashMap<>();

    public ListCollectionStage(
        FetchCapability fetchCapability,
        ConcurrencyPool pool,
        SiteTotalsCache totalsCache,
        RecordStore recordStore,
        PageIndexMapper mapper,
        CrawlerProperties.ListStage settings,
        Clock clock,
        CrawlEventListener listener
    ) {
        this.fetchCapability = fetchCapability;
        this.pool = pool;
        this.totalsCache = totalsCache;
        this.recordStore = recordStore;
        this.mapper = mapper;
        this.settings = settings;
        this.clock = clock;
        this.listener = listener == null ? event -> { } : listener;
    }

    /**
     * Range still to collect: from the oldest site page not yet covered by {@code collectedRecords} towards
     * pageId 0, capped at {@code pageLimit} pages when positive. Returns {@code null} when nothing is left.
     */
    public static PageRange computeRange(
        SiteTotalsSnapshot totals,
        int pageLimit,
        long collectedRecords,
        PageIndexMapper mapper
    ) {
        int totalPages = totals.totalPages();
        int collectedPages = collectedSitePages(collectedRecords, mapper.boundaryPageCount(totals.lastPageRecordCount()), mapper.pageSize());
        if (collectedPages >= totalPages) {
            return null;
        }
        int startPageId = totalPages - collectedPages - 1;
        int endPageId = pageLimit > 0 ? Math.max(0, startPageId - pageLimit + 1) : 0;
        return new PageRange(startPageId, endPageId);
    }

    static int collectedSitePages(long collectedRecords, int boundaryCount, int pageSize) {
        if (collectedRecords <= 0) {
            return 0;
        }
        if (collectedRecords <= boundaryCount) {
            return 1;
        }
        long beyondBoundary = collectedRecords - boundaryCount;
        long pages = 1 + (beyondBoundary + pageSize - 1) / pageSize;
        return (int) Math.min(Integer.MAX_VALUE, pages);
    }

    public ListCollectionResult collect(int pageLimit, CancelToken cancelToken) {
        CancelToken token = cancelToken == null ? CancelToken.create() : cancelToken;
        SiteTotalsSnapshot totals = totalsCache.get(fetchCapability, token);
        PageRange range = computeRange(totals, pageLimit, recordStore.totalRecordCount(), mapper);
        if (range == null) {
            log.info("Listing range is empty: {} site pages already collected", totals.totalPages());
            return ListCollectionResult.empty(totals);
        }

        List<Integer> unitIds = range.descendingPageIds();
        for (Integer pageId : unitIds) {
            cache.put(pageId, new PageAccumulator());
        }
        StageState state = new StageState(StageKind.LIST, unitIds, settings.getMaxRetries(), clock, listener);
        state.setStage(
            StagePhase.COLLECTING,
            "collecting " + unitIds.size() + " pages, pageId " + range.startPageId() + " to " + range.endPageId()
        );
        runInitialPass(unitIds, state, totals, token);

        while (!token.isCancelled() && state.canRetry()) {
            List<Integer> outstanding = state.outstandingUnitIds();
            state.setStage(
                StagePhase.RETRYING,
                outstanding.size() + " pages incomplete, scheduling retry cycle " + (state.retryCycle() + 1)
            );
            listener.onEvent(new RetryCycleEvent(
                StageKind.LIST,
                state.retryCycle(),
                state.maxRetries(),
                outstanding.size(),
                settings.getRetryConcurrency(),
                clock.instant()
            ));
            if (!token.sleep(Duration.ofMillis(settings.getRetryDelayMs()))) {
                break;
            }
            state.setStage(
                StagePhase.COLLECTING,
                "retry cycle " + state.retryCycle() + " collecting " + outstanding.size() + " pages"
            );
            pool.run(outstanding, (pageId, cancel) -> collectPage(pageId, state, totals, cancel), settings.getRetryConcurrency(), token);
        }

        if (token.isCancelled()) {
            state.markCancelled();
        }
        List<CatalogRecord> records = flatten(range, totals);
        int unresolved = state.totalUnits() - state.count(PageUnitStatus.SUCCESS);
        state.setStage(
            StagePhase.PROCESSING,
            unresolved == 0
                ? "all " + state.totalUnits() + " pages complete"
                : unresolved + " pages unresolved after " + state.retryCycle() + " retry cycles"
        );

        List<FailedUnitReport> failures = state.failureReports(
            pageId -> PageIndexMapper.toSitePage(pageId, totals.totalPages()),
            null
        );
        boolean cancelled = state.isCancelled();
        boolean stageFailed = unresolved > 0;
        if (cancelled) {
            state.setStage(StagePhase.FAILED, "cancelled: " + token.reason());
        } else if (stageFailed) {
            state.setStage(StagePhase.FAILED, unresolved + " pages unresolved, listing stage failed");
        } else {
            state.setStage(StagePhase.COMPLETE, records.size() + " records from " + state.totalUnits() + " pages");
        }

        ListCollectionResult result = new ListCollectionResult(
            totals,
            range,
            records,
            state.totalUnits(),
            state.attemptedUnits(),
            state.count(PageUnitStatus.SUCCESS),
            state.successRate(),
            state.retryCycle(),
            failures,
            cancelled,
            stageFailed
        );
        listener.onEvent(new StageSummaryEvent(
            StageKind.LIST,
            result.totalUnits(),
            result.attemptedUnits(),
            result.succeededUnits(),
            result.successRate(),
            result.retryCycles(),
            stageFailed,
            cancelled,
            state.elapsed(),
            failures,
            clock.instant()
        ));
        cache.clear();
        return result;
    }

    private void runInitialPass(List<Integer> unitIds, StageState state, SiteTotalsSnapshot totals, CancelToken token) {
        CrawlerProperties.Batch batch = settings.getBatch();
        if (!batch.isEnabled() || unitIds.size() <= batch.getBatchSize()) {
            pool.run(unitIds, (pageId, cancel) -> collectPage(pageId, state, totals, cancel), settings.getInitialConcurrency(), token);
            return;
        }
        int batchCount = (unitIds.size() + batch.getBatchSize() - 1) / batch.getBatchSize();
        for (int i = 0; i < batchCount && !token.isCancelled(); i++) {
            List<Integer> slice = unitIds.subList(
                i * batch.getBatchSize(),
                Math.min(unitIds.size(), (i + 1) * batch.getBatchSize())
            );
            log.info("Listing batch {}/{}: {} pages", i + 1, batchCount, slice.size());
            pool.run(slice, (pageId, cancel) -> collectPage(pageId, state, totals, cancel), settings.getInitialConcurrency(), token);
            if (i < batchCount - 1 && !token.sleep(Duration.ofMillis(batch.getBatchDelayMs()))) {
                return;
            }
        }
    }

    private PageUnitStatus collectPage(int pageId, StageState state, SiteTotalsSnapshot totals, CancelToken token) {
        token.throwIfCancelled();
        int attempt = state.beginAttempt(pageId);
        try {
            int sitePage = PageIndexMapper.toSitePage(pageId, totals.totalPages());
            int expected = mapper.sitePageCapacity(sitePage, totals.lastPageRecordCount());
            ListingPage page = fetchCapability.fetchListingPage(sitePage, token, attempt);
            int merged = cache.get(pageId).merge(page.records(), expected);
            if (merged >= expected) {
                state.finishAttempt(pageId, PageUnitStatus.SUCCESS, null);
                return PageUnitStatus.SUCCESS;
            }
            state.finishAttempt(
                pageId,
                PageUnitStatus.INCOMPLETE,
                "collected " + merged + " of " + expected + " records from " + page.url()
            );
            return PageUnitStatus.INCOMPLETE;
        } catch (RuntimeException e) {
            CrawlException failure = FetchErrorClassifier.toCrawlException(e, "page " + pageId);
            state.finishAttempt(pageId, PageUnitStatus.FAILED, failure.kind() + " " + failure.getMessage());
            return PageUnitStatus.FAILED;
        }
    }

    private List<CatalogRecord> flatten(PageRange range, SiteTotalsSnapshot totals) {
        int offset = mapper.offset(totals.lastPageRecordCount());
        Map<String, CatalogRecord> ordered = new LinkedHashMap<>();
        for (int pageId = range.endPageId(); pageId <= range.startPageId(); pageId++) {
            PageAccumulator accumulator = cache.get(pageId);
            if (accumulator == null) {
                continue;
            }
            int sitePage = PageIndexMapper.toSitePage(pageId, totals.totalPages());
            for (ListingRecord record : accumulator.sortedBySlot()) {
                PageSlot slot = mapper.mapSlot(sitePage, record.slotInPage(), offset, totals.totalPages());
                ordered.putIfAbsent(
                    record.url(),
                    new CatalogRecord(record.url(), record.title(), sitePage, slot.pageId(), slot.indexInPage())
                );
            }
        }
        return new ArrayList<>(ordered.values());
    }
}
