package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;

public record CrawlStatusSummary(
    long storedRecordCount,
    int siteTotalPages,
    int lastPageRecordCount,
    long siteRecordCount,
    long difference,
    boolean needCrawling,
    PageRange crawlingRange,
    int selectedPageCount,
    long estimatedRecordCount,
    long estimatedDurationMs,
    Long activeRunId,
    Instant checkedAt
) {
}
