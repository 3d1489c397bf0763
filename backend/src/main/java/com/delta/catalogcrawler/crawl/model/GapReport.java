package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;
import java.util.List;

public record GapReport(
    int totalPages,
    int lastPageRecordCount,
    int offset,
    boolean totalsFromFallback,
    int maxObservedPageId,
    List<PageGap> missingPages,
    List<Integer> completelyMissingPageIds,
    List<Integer> partiallyMissingPageIds,
    int totalMissingRecords,
    int totalExpectedRecords,
    int totalActualRecords,
    double completionPercentage,
    List<CrawlingRange> crawlingRanges,
    BatchRecommendation batchRecommendation,
    Instant detectedAt
) {
    public GapReport {
        missingPages = missingPages == null ? List.of() : List.copyOf(missingPages);
        completelyMissingPageIds = completelyMissingPageIds == null ? List.of() : List.copyOf(completelyMissingPageIds);
        partiallyMissingPageIds = partiallyMissingPageIds == null ? List.of() : List.copyOf(partiallyMissingPageIds);
        crawlingRanges = crawlingRanges == null ? List.of() : List.copyOf(crawlingRanges);
    }

    public boolean isComplete() {
        return missingPages.isEmpty();
    }
}
