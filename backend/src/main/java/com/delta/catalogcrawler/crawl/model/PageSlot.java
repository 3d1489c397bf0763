package com.delta.catalogcrawler.crawl.model;

public record PageSlot(
    int pageId,
    int indexInPage
) {
}
