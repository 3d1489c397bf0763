package com.delta.catalogcrawler.crawl.gap;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.concurrent.CancelToken;
import com.delta.catalogcrawler.crawl.concurrent.ConcurrencyPool;
import com.delta.catalogcrawler.crawl.concurrent.PoolResult;
import com.delta.catalogcrawler.crawl.fetch.CrawlException;
import com.delta.catalogcrawler.crawl.fetch.FetchCapability;
import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.GapCollectionOptions;
import com.delta.catalogcrawler.crawl.model.GapCollectionResult;
import com.delta.catalogcrawler.crawl.model.GapReport;
import com.delta.catalogcrawler.crawl.model.ListingPage;
import com.delta.catalogcrawler.crawl.model.ListingRecord;
import com.delta.catalogcrawler.crawl.model.PageGap;
import com.delta.catalogcrawler.crawl.model.PageGapOutcome;
import com.delta.catalogcrawler.crawl.model.PageSlot;
import com.delta.catalogcrawler.crawl.model.SaveResult;
import com.delta.catalogcrawler.crawl.model.SitePageSlot;
import com.delta.catalogcrawler.crawl.persistence.RecordStore;
import com.delta.catalogcrawler.crawl.progress.CrawlEventListener;
import com.delta.catalogcrawler.crawl.progress.GapCollectionEvent;
import com.delta.catalogcrawler.crawl.util.PageIndexMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Refetches the site pages behind the positions a {@link GapReport} lists and stores the records found there.
 *
 * <p>Only missing positions are written, so running the same report twice adds nothing the second time.
 */
@Service
public class GapCollector {
    private static final Logger log = LoggerFactory.getLogger(GapCollector.class);

    private final RecordStore recordStore;
    private final ConcurrencyPool concurrencyPool;
    private final CrawlerProperties properties;
    private final Clock clock;

    public GapCollector(
        RecordStore recordStore,
        ConcurrencyPool concurrencyPool,
        CrawlerProperties properties,
        Clock clock
    ) {
        this.recordStore = recordStore;
        this.concurrencyPool = concurrencyPool;
        this.properties = properties;
        this.clock = clock;
    }

    public GapCollectionOptions defaultOptions() {
        CrawlerProperties.Gap gap = properties.getGap();
        return new GapCollectionOptions(
            gap.getMaxConcurrentPages(),
            gap.getDelayBetweenPagesMs(),
            gap.isPrioritizePartialPages()
        );
    }

    public GapCollectionResult collect(
        GapReport report,
        FetchCapability fetchCapability,
        GapCollectionOptions options,
        CancelToken cancelToken,
        CrawlEventListener listener
    ) {
        return collectPages(report, report.missingPages(), fetchCapability, options, cancelToken, listener);
    }

    public GapCollectionResult collectPage(
        GapReport report,
        int pageId,
        FetchCapability fetchCapability,
        GapCollectionOptions options,
        CancelToken cancelToken,
        CrawlEventListener listener
    ) {
        List<PageGap> target = report.missingPages().stream()
            .filter(gap -> gap.pageId() == pageId)
            .toList();
        if (target.isEmpty()) {
            log.info("pageId {} has no missing positions", pageId);
        }
        return collectPages(report, target, fetchCapability, options, cancelToken, listener);
    }

    private GapCollectionResult collectPages(
        GapReport report,
        List<PageGap> gaps,
        FetchCapability fetchCapability,
        GapCollectionOptions options,
        CancelToken cancelToken,
        CrawlEventListener listener
    ) {
        CancelToken token = cancelToken == null ? CancelToken.create() : cancelToken;
        GapCollectionOptions effective = options == null ? defaultOptions() : options;
        if (gaps.isEmpty()) {
            return GapCollectionResult.empty();
        }

        List<PageGap> ordered = new ArrayList<>(gaps);
        if (effective.prioritizePartialPages()) {
            ordered.sort(
                Comparator.comparingInt((PageGap gap) -> gap.isPartial() ? 0 : 1)
                    .thenComparingInt(gap -> gap.missingIndices().size())
                    .thenComparingInt(PageGap::pageId)
            );
        } else {
            ordered.sort(Comparator.comparingInt(PageGap::pageId));
        }
        log.info(
            "Collecting gaps on {} pages via {} (chunk {}, delay {}ms)",
            ordered.size(),
            fetchCapability.name(),
            effective.maxConcurrentPages(),
            effective.delayBetweenPagesMs()
        );

        List<PageGapOutcome> outcomes = new ArrayList<>();
        int chunkSize = effective.maxConcurrentPages();
        for (int from = 0; from < ordered.size() && !token.isCancelled(); from += chunkSize) {
            if (from > 0 && effective.delayBetweenPagesMs() > 0
                && !token.sleep(Duration.ofMillis(effective.delayBetweenPagesMs()))) {
                break;
            }
            List<PageGap> chunk = ordered.subList(from, Math.min(ordered.size(), from + chunkSize));
            List<PoolResult<PageGapOutcome>> results = concurrencyPool.run(
                chunk,
                (gap, workerToken) -> collectOne(report, gap, fetchCapability, workerToken),
                chunk.size(),
                token
            );
            for (PoolResult<PageGapOutcome> result : results) {
                PageGap gap = chunk.get(result.index());
                if (result.isCompleted()) {
                    outcomes.add(result.value());
                } else if (result.outcome() == PoolResult.Outcome.FAILED) {
                    String message = String.valueOf(result.error() == null ? null : result.error().getMessage());
                    outcomes.add(new PageGapOutcome(
                        gap.pageId(),
                        List.of(),
                        PageGapOutcome.FAILED,
                        gap.missingIndices().size(),
                        0,
                        0,
                        message
                    ));
                } else {
                    outcomes.add(notCollected(gap, token));
                }
            }
        }
        for (int i = outcomes.size(); i < ordered.size(); i++) {
            outcomes.add(notCollected(ordered.get(i), token));
        }

        int collected = 0;
        int failed = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();
        List<Integer> collectedPageIds = new ArrayList<>();
        List<Integer> failedPageIds = new ArrayList<>();
        for (PageGapOutcome outcome : outcomes) {
            collected += outcome.collectedCount();
            skipped += outcome.skippedCount();
            if (PageGapOutcome.FAILED.equals(outcome.status())) {
                failed += outcome.missingCount();
                failedPageIds.add(outcome.pageId());
                errors.add("pageId " + outcome.pageId() + ": " + outcome.error());
            } else if (outcome.collectedCount() > 0) {
                collectedPageIds.add(outcome.pageId());
            }
        }
        boolean cancelled = token.isCancelled();
        GapCollectionResult result = new GapCollectionResult(
            collected,
            failed,
            skipped,
            outcomes,
            errors,
            collectedPageIds,
            failedPageIds,
            cancelled
        );
        log.info(
            "Gap collection finished: collected={} skipped={} failed={} pages={} cancelled={}",
            collected,
            skipped,
            failed,
            outcomes.size(),
            cancelled
        );
        if (listener != null) {
            listener.onEvent(new GapCollectionEvent(ordered.size(), collected, failed, skipped, cancelled, clock.instant()));
        }
        return result;
    }

    private static PageGapOutcome notCollected(PageGap gap, CancelToken token) {
        int missing = gap.missingIndices().size();
        String reason = token.isCancelled() ? "cancelled: " + token.reason() : "not started";
        return new PageGapOutcome(gap.pageId(), List.of(), PageGapOutcome.SKIPPED, missing, 0, missing, reason);
    }

    private PageGapOutcome collectOne(GapReport report, PageGap gap, FetchCapability fetchCapability, CancelToken token) {
        int missingCount = gap.missingIndices().size();
        List<Integer> sitePages = new ArrayList<>();
        try {
            if (report.totalsFromFallback()) {
                throw CrawlException.initialization("site totals unavailable; positions cannot be mapped to site pages");
            }
            PageIndexMapper mapper = new PageIndexMapper(properties.getCatalog().getPageSize());
            int totalPages = report.totalPages();
            Map<Integer, Set<Integer>> slotsBySitePage = new TreeMap<>();
            for (Integer index : gap.missingIndices()) {
                SitePageSlot slot = mapper.unmapSlot(gap.pageId(), index, report.offset(), totalPages);
                slotsBySitePage.computeIfAbsent(slot.sitePage(), ignored -> new HashSet<>()).add(slot.slotInPage());
            }
            sitePages.addAll(slotsBySitePage.keySet());

            List<CatalogRecord> found = new ArrayList<>();
            for (Map.Entry<Integer, Set<Integer>> entry : slotsBySitePage.entrySet()) {
                token.throwIfCancelled();
                int sitePage = entry.getKey();
                ListingPage page = fetchCapability.fetchListingPage(sitePage, token, 1);
                for (ListingRecord record : page.records()) {
                    if (!entry.getValue().contains(record.slotInPage())) {
                        continue;
                    }
                    PageSlot position = mapper.mapSlot(sitePage, record.slotInPage(), report.offset(), totalPages);
                    if (position.pageId() != gap.pageId()) {
                        continue;
                    }
                    found.add(new CatalogRecord(
                        record.url(),
                        record.title(),
                        sitePage,
                        position.pageId(),
                        position.indexInPage()
                    ));
                }
            }

            SaveResult saved = found.isEmpty() ? SaveResult.empty() : recordStore.save(found);
            int collected = saved.added() + saved.updated();
            int skipped = missingCount - found.size();
            String status;
            if (found.isEmpty()) {
                status = PageGapOutcome.SKIPPED;
            } else if (skipped > 0 || saved.failed() > 0) {
                status = PageGapOutcome.PARTIAL;
            } else {
                status = PageGapOutcome.COLLECTED;
            }
            log.debug("pageId {} gap: {} (collected {}, skipped {})", gap.pageId(), status, collected, skipped);
            return new PageGapOutcome(gap.pageId(), sitePages, status, missingCount, collected, skipped, null);
        } catch (CrawlException e) {
            if (e.isAborted()) {
                throw e;
            }
            log.warn("pageId {} gap collection failed: {}", gap.pageId(), e.getMessage());
            return new PageGapOutcome(gap.pageId(), sitePages, PageGapOutcome.FAILED, missingCount, 0, 0, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("pageId {} gap collection failed", gap.pageId(), e);
            return new PageGapOutcome(gap.pageId(), sitePages, PageGapOutcome.FAILED, missingCount, 0, 0, e.getMessage());
        }
    }
}
