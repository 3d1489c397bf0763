package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;

public record CrawlRunView(
    long crawlRunId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    String notes,
    int pagesAttempted,
    int pagesSucceeded,
    int recordsCollected,
    int failedPageCount
) {
}
