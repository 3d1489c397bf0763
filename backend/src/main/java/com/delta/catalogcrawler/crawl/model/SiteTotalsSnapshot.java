package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;

public record SiteTotalsSnapshot(
    int totalPages,
    int lastPageRecordCount,
    Instant fetchedAt
) {
    public SiteTotalsSnapshot {
        if (totalPages <= 0) {
            throw new IllegalArgumentException("totalPages must be positive: " + totalPages);
        }
        if (lastPageRecordCount < 0) {
            throw new IllegalArgumentException("lastPageRecordCount must not be negative: " + lastPageRecordCount);
        }
    }

    public static SiteTotalsSnapshot of(SiteTotals totals, Instant fetchedAt) {
        return new SiteTotalsSnapshot(totals.totalPages(), totals.lastPageRecordCount(), fetchedAt);
    }
}
