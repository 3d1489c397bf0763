package com.delta.catalogcrawler.crawl.model;

public record CatalogRecord(
    String url,
    String title,
    int sitePage,
    int pageId,
    int indexInPage
) {
}
