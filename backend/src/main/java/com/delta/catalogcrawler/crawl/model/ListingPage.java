package com.delta.catalogcrawler.crawl.model;

import java.util.List;

public record ListingPage(
    int sitePage,
    String url,
    int attempt,
    List<ListingRecord> records
) {
    public ListingPage {
        records = records == null ? List.of() : List.copyOf(records);
    }
}
