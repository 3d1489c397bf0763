package com.delta.catalogcrawler.crawl.model;

public record SiteTotals(
    int totalPages,
    int lastPageRecordCount
) {
}
