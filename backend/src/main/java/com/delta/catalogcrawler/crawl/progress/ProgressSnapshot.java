package com.delta.catalogcrawler.crawl.progress;

import com.delta.catalogcrawler.crawl.stage.StageKind;
import com.delta.catalogcrawler.crawl.stage.StagePhase;

import java.time.Duration;
import java.time.Instant;

public record ProgressSnapshot(
    long sequence,
    StageKind stage,
    StagePhase phase,
    int totalUnits,
    int waitingUnits,
    int attemptingUnits,
    int succeededUnits,
    int incompleteUnits,
    int failedUnits,
    int retryCycle,
    double percentage,
    Duration elapsed,
    Duration estimatedRemaining,
    String message,
    Instant at
) implements CrawlEvent {
}
