package com.delta.catalogcrawler.crawl.model;

public record ListingRecord(
    String url,
    String title,
    int slotInPage
) {
}
