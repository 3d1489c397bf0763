package com.delta.catalogcrawler.crawl.model;

import java.util.List;

public record PageGapOutcome(
    int pageId,
    List<Integer> sitePages,
    String status,
    int missingCount,
    int collectedCount,
    int skippedCount,
    String error
) {
    public static final String COLLECTED = "COLLECTED";
    public static final String PARTIAL = "PARTIAL";
    public static final String SKIPPED = "SKIPPED";
    public static final String FAILED = "FAILED";

    public PageGapOutcome {
        sitePages = sitePages == null ? List.of() : List.copyOf(sitePages);
    }
}
