package com.delta.catalogcrawler.crawl.progress;

import com.delta.catalogcrawler.crawl.model.FailedUnitReport;
import com.delta.catalogcrawler.crawl.stage.StageKind;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record StageSummaryEvent(
    StageKind stage,
    int totalUnits,
    int attemptedUnits,
    int succeededUnits,
    double successRate,
    int retryCycles,
    boolean stageFailed,
    boolean cancelled,
    Duration elapsed,
    List<FailedUnitReport> failures,
    Instant at
) implements CrawlEvent {
}
