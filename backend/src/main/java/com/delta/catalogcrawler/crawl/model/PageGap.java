package com.delta.catalogcrawler.crawl.model;

import java.util.List;

public record PageGap(
    int pageId,
    List<Integer> missingIndices,
    int expectedCount,
    int actualCount,
    double completenessRatio
) {
    public PageGap {
        missingIndices = missingIndices == null ? List.of() : List.copyOf(missingIndices);
    }

    public boolean isFullyMissing() {
        return actualCount == 0 && expectedCount > 0;
    }

    public boolean isPartial() {
        return actualCount > 0 && !missingIndices.isEmpty();
    }
}
