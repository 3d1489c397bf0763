package com.delta.catalogcrawler.crawl.progress;

import java.time.Instant;

/**
 * Fire-and-forget notification emitted by the engine. Boundary events are never throttled.
 */
public interface CrawlEvent {
    Instant at();

    default boolean boundary() {
        return true;
    }
}
