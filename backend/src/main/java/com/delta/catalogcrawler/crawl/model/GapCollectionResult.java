package com.delta.catalogcrawler.crawl.model;

import java.util.List;

public record GapCollectionResult(
    int collected,
    int failed,
    int skipped,
    List<PageGapOutcome> pageOutcomes,
    List<String> errors,
    List<Integer> collectedPageIds,
    List<Integer> failedPageIds,
    boolean cancelled
) {
    public GapCollectionResult {
        pageOutcomes = pageOutcomes == null ? List.of() : List.copyOf(pageOutcomes);
        errors = errors == null ? List.of() : List.copyOf(errors);
        collectedPageIds = collectedPageIds == null ? List.of() : List.copyOf(collectedPageIds);
        failedPageIds = failedPageIds == null ? List.of() : List.copyOf(failedPageIds);
    }

    public static GapCollectionResult empty() {
        return new GapCollectionResult(0, 0, 0, List.of(), List.of(), List.of(), List.of(), false);
    }
}
