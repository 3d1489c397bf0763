package com.delta.catalogcrawler.crawl.gap;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.fetch.CrawlException;
import com.delta.catalogcrawler.crawl.model.BatchRecommendation;
import com.delta.catalogcrawler.crawl.model.CrawlingRange;
import com.delta.catalogcrawler.crawl.model.GapReport;
import com.delta.catalogcrawler.crawl.model.PageGap;
import com.delta.catalogcrawler.crawl.model.SiteTotalsSnapshot;
import com.delta.catalogcrawler.crawl.persistence.RecordStore;
import com.delta.catalogcrawler.crawl.util.PageIndexMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Compares stored record positions against the positions the site totals imply.
 */
@Service
public class GapDetector {
    private static final Logger log = LoggerFactory.getLogger(GapDetector.class);
    private static final int MAX_RECOMMENDED_CONCURRENCY = 5;

    private final RecordStore recordStore;
    private final CrawlerProperties properties;
    private final Clock clock;

    public GapDetector(RecordStore recordStore, CrawlerProperties properties, Clock clock) {
        this.recordStore = recordStore;
        this.properties = properties;
        this.clock = clock;
    }

    public GapReport detect(Supplier<SiteTotalsSnapshot> totalsSupplier) {
        OptionalInt maxKnown = recordStore.maxKnownPageId();
        int maxObserved = maxKnown.orElse(-1);
        Totals totals = resolveTotals(totalsSupplier, maxObserved);
        return scan(totals, maxObserved, 0, maxObserved);
    }

    public GapReport detectInRange(int startPageId, int endPageId, Supplier<SiteTotalsSnapshot> totalsSupplier) {
        if (endPageId < 0 || startPageId < endPageId) {
            throw new IllegalArgumentException("invalid detection range " + startPageId + ".." + endPageId);
        }
        int maxObserved = recordStore.maxKnownPageId().orElse(-1);
        Totals totals = resolveTotals(totalsSupplier, Math.max(maxObserved, startPageId));
        return scan(totals, maxObserved, endPageId, startPageId);
    }

    public void logReport(GapReport report) {
        log.info(
            "Gap report: totalPages={} (fallback={}) maxObservedPageId={} missingPages={} (full={}, partial={}) missingRecords={} completion={}%",
            report.totalPages(),
            report.totalsFromFallback(),
            report.maxObservedPageId(),
            report.missingPages().size(),
            report.completelyMissingPageIds().size(),
            report.partiallyMissingPageIds().size(),
            report.totalMissingRecords(),
            String.format("%.2f", report.completionPercentage())
        );
        for (CrawlingRange range : report.crawlingRanges()) {
            log.info(
                "  priority {} site pages {}-{} (~{} records): {}",
                range.priority(),
                range.startSitePage(),
                range.endSitePage(),
                range.estimatedRecords(),
                range.reason()
            );
        }
        BatchRecommendation batch = report.batchRecommendation();
        if (batch != null && batch.totalPagesToCrawl() > 0) {
            log.info(
                "  recommended: {} pages in {} batches of {}, concurrency {}, ~{} min",
                batch.totalPagesToCrawl(),
                batch.totalBatches(),
                batch.batchSize(),
                batch.recommendedConcurrency(),
                batch.estimatedMinutes()
            );
        }
    }

    private GapReport scan(Totals totals, int maxObserved, int fromPageId, int toPageId) {
        PageIndexMapper mapper = new PageIndexMapper(properties.getCatalog().getPageSize());
        List<PageGap> gaps = new ArrayList<>();
        List<Integer> fullyMissing = new ArrayList<>();
        List<Integer> partiallyMissing = new ArrayList<>();
        int totalExpected = 0;
        int totalMissing = 0;
        for (int pageId = fromPageId; pageId <= toPageId; pageId++) {
            int expected = mapper.expectedStoredCount(pageId, totals.offset());
            int actual = recordStore.countExisting(pageId);
            totalExpected += expected;
            if (actual >= expected) {
                continue;
            }
            List<Integer> missing = new ArrayList<>();
            if (actual == 0) {
                for (int index = 0; index < expected; index++) {
                    missing.add(index);
                }
            } else {
                Set<Integer> existing = recordStore.existingSlotIndices(pageId);
                for (int index = 0; index < expected; index++) {
                    if (!existing.contains(index)) {
                        missing.add(index);
                    }
                }
            }
            if (missing.isEmpty()) {
                continue;
            }
            int present = expected - missing.size();
            gaps.add(new PageGap(pageId, missing, expected, present, (double) present / expected));
            if (present == 0) {
                fullyMissing.add(pageId);
            } else {
                partiallyMissing.add(pageId);
            }
            totalMissing += missing.size();
        }

        List<CrawlingRange> ranges = buildRanges(gaps, totals, mapper);
        int totalActual = totalExpected - totalMissing;
        double completion = totalExpected == 0 ? 100.0 : totalActual * 100.0 / totalExpected;
        return new GapReport(
            totals.totalPages(),
            totals.lastPageRecordCount(),
            totals.offset(),
            totals.fallback(),
            maxObserved,
            gaps,
            fullyMissing,
            partiallyMissing,
            totalMissing,
            totalExpected,
            totalActual,
            completion,
            ranges,
            recommend(ranges),
            clock.instant()
        );
    }

    private List<CrawlingRange> buildRanges(List<PageGap> gaps, Totals totals, PageIndexMapper mapper) {
        int totalPages = totals.totalPages();
        int pageSize = mapper.pageSize();
        int spillFrom = pageSize - totals.offset();
        Map<Integer, Set<Integer>> pageIdsBySitePage = new TreeMap<>();
        Map<Integer, PageGap> gapsById = new TreeMap<>();
        for (PageGap gap : gaps) {
            if (gap.pageId() >= totalPages) {
                log.warn("pageId {} has no site page among {} pages; left out of crawling ranges", gap.pageId(), totalPages);
                continue;
            }
            gapsById.put(gap.pageId(), gap);
            int sitePage = PageIndexMapper.toSitePage(gap.pageId(), totalPages);
            pageIdsBySitePage.computeIfAbsent(sitePage, ignored -> new TreeSet<>()).add(gap.pageId());
            boolean spills = totals.offset() > 0
                && sitePage + 1 <= totalPages
                && gap.missingIndices().stream().anyMatch(index -> index >= spillFrom);
            if (spills) {
                pageIdsBySitePage.computeIfAbsent(sitePage + 1, ignored -> new TreeSet<>()).add(gap.pageId());
            }
        }

        List<CrawlingRange> ranges = new ArrayList<>();
        Integer start = null;
        Integer end = null;
        Set<Integer> contained = new TreeSet<>();
        for (Map.Entry<Integer, Set<Integer>> entry : pageIdsBySitePage.entrySet()) {
            int sitePage = entry.getKey();
            if (end != null && sitePage - end > properties.getGap().getMergeDistance()) {
                ranges.add(toRange(start, end, contained, gapsById, totalPages, pageSize));
                start = null;
                contained = new TreeSet<>();
            }
            if (start == null) {
                start = sitePage;
            }
            end = sitePage;
            contained.addAll(entry.getValue());
        }
        if (start != null) {
            ranges.add(toRange(start, end, contained, gapsById, totalPages, pageSize));
        }
        ranges.sort(Comparator.comparingInt(CrawlingRange::priority).thenComparingInt(CrawlingRange::startSitePage));
        return ranges;
    }

    private CrawlingRange toRange(
        int start,
        int end,
        Set<Integer> contained,
        Map<Integer, PageGap> gapsById,
        int totalPages,
        int pageSize
    ) {
        int full = 0;
        int partial = 0;
        for (Integer pageId : contained) {
            if (gapsById.get(pageId).isFullyMissing()) {
                full++;
            } else {
                partial++;
            }
        }
        int span = end - start + 1;
        int priority;
        if (span >= 3) {
            priority = 1;
        } else if (full > 0) {
            priority = 2;
        } else {
            priority = 3;
        }
        int expandedStart = Math.max(1, start - 1);
        int expandedEnd = Math.min(totalPages, end + 1);
        String reason = "site pages " + start + "-" + end + ": " + full + " fully missing, " + partial
            + " partial, pageIds " + contained;
        return new CrawlingRange(
            expandedStart,
            expandedEnd,
            new ArrayList<>(contained),
            priority,
            (expandedEnd - expandedStart + 1) * pageSize,
            reason
        );
    }

    private BatchRecommendation recommend(List<CrawlingRange> ranges) {
        int pages = 0;
        for (CrawlingRange range : ranges) {
            pages += range.pageCount();
        }
        int batchSize = properties.getGap().getBatchPages();
        int batches = (pages + batchSize - 1) / batchSize;
        int seconds = pages * properties.getGap().getSecondsPerPage() + batches;
        int minutes = (seconds + 59) / 60;
        int concurrency = Math.min(MAX_RECOMMENDED_CONCURRENCY, Math.max(1, (batches + 2) / 3));
        return new BatchRecommendation(pages, batchSize, batches, minutes, concurrency);
    }

    private Totals resolveTotals(Supplier<SiteTotalsSnapshot> totalsSupplier, int maxObserved) {
        PageIndexMapper mapper = new PageIndexMapper(properties.getCatalog().getPageSize());
        try {
            SiteTotalsSnapshot snapshot = totalsSupplier.get();
            return new Totals(
                snapshot.totalPages(),
                snapshot.lastPageRecordCount(),
                mapper.offset(snapshot.lastPageRecordCount()),
                false
            );
        } catch (CrawlException e) {
            if (e.isAborted()) {
                throw e;
            }
            int fallbackPages = Math.max(1, maxObserved + 1 + properties.getGap().getFallbackMargin());
            log.warn("Site totals unavailable ({}); assuming {} pages from stored data", e.getMessage(), fallbackPages);
            return new Totals(fallbackPages, 0, 0, true);
        }
    }

    private record Totals(int totalPages, int lastPageRecordCount, int offset, boolean fallback) {
    }
}
