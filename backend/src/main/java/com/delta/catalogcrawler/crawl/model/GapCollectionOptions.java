package com.delta.catalogcrawler.crawl.model;

public record GapCollectionOptions(
    int maxConcurrentPages,
    int delayBetweenPagesMs,
    boolean prioritizePartialPages
) {
    public GapCollectionOptions {
        maxConcurrentPages = Math.max(1, maxConcurrentPages);
        delayBetweenPagesMs = Math.max(0, delayBetweenPagesMs);
    }
}
