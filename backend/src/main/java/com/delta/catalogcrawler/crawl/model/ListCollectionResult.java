package com.delta.catalogcrawler.crawl.model;

import java.util.List;

public record ListCollectionResult(
    SiteTotalsSnapshot totals,
    PageRange range,
    List<CatalogRecord> records,
    int totalUnits,
    int attemptedUnits,
    int succeededUnits,
    double successRate,
    int retryCycles,
    List<FailedUnitReport> failedPages,
    boolean cancelled,
    boolean stageFailed
) {
    public ListCollectionResult {
        records = records == null ? List.of() : List.copyOf(records);
        failedPages = failedPages == null ? List.of() : List.copyOf(failedPages);
    }

    public static ListCollectionResult empty(SiteTotalsSnapshot totals) {
        return new ListCollectionResult(totals, null, List.of(), 0, 0, 0, 1.0, 0, List.of(), false, false);
    }

    public boolean isEmptyRange() {
        return range == null;
    }
}
