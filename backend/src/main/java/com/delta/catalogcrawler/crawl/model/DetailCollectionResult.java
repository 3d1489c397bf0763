package com.delta.catalogcrawler.crawl.model;

import java.util.List;

public record DetailCollectionResult(
    List<RecordDetail> details,
    int totalUnits,
    int attemptedUnits,
    int succeededUnits,
    double successRate,
    int retryCycles,
    List<FailedUnitReport> failedRecords,
    boolean cancelled
) {
    public DetailCollectionResult {
        details = details == null ? List.of() : List.copyOf(details);
        failedRecords = failedRecords == null ? List.of() : List.copyOf(failedRecords);
    }

    public static DetailCollectionResult empty() {
        return new DetailCollectionResult(List.of(), 0, 0, 0, 1.0, 0, List.of(), false);
    }
}
