package com.delta.catalogcrawler.crawl.model;

import java.util.List;

public record CrawlingRange(
    int startSitePage,
    int endSitePage,
    List<Integer> containedMissingPageIds,
    int priority,
    int estimatedRecords,
    String reason
) {
    public CrawlingRange {
        containedMissingPageIds = containedMissingPageIds == null ? List.of() : List.copyOf(containedMissingPageIds);
    }

    public int pageCount() {
        return endSitePage - startSitePage + 1;
    }
}
