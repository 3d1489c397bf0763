package com.delta.catalogcrawler.crawl.progress;

import com.delta.catalogcrawler.crawl.stage.StageKind;
import com.delta.catalogcrawler.crawl.stage.StagePhase;

import java.time.Instant;

public record StageTransitionEvent(
    StageKind stage,
    StagePhase from,
    StagePhase to,
    String reason,
    int totalUnits,
    int retryCycle,
    Instant at
) implements CrawlEvent {
}
