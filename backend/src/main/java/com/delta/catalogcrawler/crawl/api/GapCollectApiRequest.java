package com.delta.catalogcrawler.crawl.api;

public record GapCollectApiRequest(
    Integer maxConcurrentPages,
    Integer delayBetweenPagesMs,
    Boolean prioritizePartialPages
) {
}
