package com.delta.catalogcrawler.crawl.model;

import java.util.List;

/**
 * Unresolved unit at stage end. {@code sitePage} and {@code url} are set for listing and detail units respectively.
 */
public record FailedUnitReport(
    int unitId,
    Integer sitePage,
    String url,
    PageUnitStatus status,
    int attempts,
    List<String> errors
) {
    public FailedUnitReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
