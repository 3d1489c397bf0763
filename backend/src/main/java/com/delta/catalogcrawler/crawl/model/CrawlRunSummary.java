package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;
import java.util.List;

public record CrawlRunSummary(
    long crawlRunId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    String notes,
    PageRange range,
    int pagesAttempted,
    int pagesSucceeded,
    double listSuccessRate,
    int recordsCollected,
    int detailsCollected,
    int detailsFailed,
    SaveResult saved,
    List<FailedUnitReport> failedPages
) {
    public CrawlRunSummary {
        failedPages = failedPages == null ? List.of() : List.copyOf(failedPages);
    }
}
