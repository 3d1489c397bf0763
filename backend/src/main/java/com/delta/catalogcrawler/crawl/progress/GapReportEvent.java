package com.delta.catalogcrawler.crawl.progress;

import java.time.Instant;

public record GapReportEvent(
    int missingPages,
    int totalMissingRecords,
    int crawlingRanges,
    double completionPercentage,
    boolean totalsFromFallback,
    Instant at
) implements CrawlEvent {
}
