package com.delta.catalogcrawler.crawl.progress;

import java.time.Instant;

public record GapCollectionEvent(
    int targetPages,
    int collected,
    int failed,
    int skipped,
    boolean cancelled,
    Instant at
) implements CrawlEvent {
}
