package com.delta.catalogcrawler.crawl.progress;

import com.delta.catalogcrawler.crawl.model.SaveResult;

import java.time.Instant;

public record RecordsSavedEvent(
    long crawlRunId,
    String kind,
    SaveResult result,
    Instant at
) implements CrawlEvent {
}
