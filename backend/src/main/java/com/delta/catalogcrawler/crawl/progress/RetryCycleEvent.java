package com.delta.catalogcrawler.crawl.progress;

import com.delta.catalogcrawler.crawl.stage.StageKind;

import java.time.Instant;

public record RetryCycleEvent(
    StageKind stage,
    int cycle,
    int maxCycles,
    int outstandingUnits,
    int concurrency,
    Instant at
) implements CrawlEvent {
}
