package com.delta.catalogcrawler.crawl.progress;

import com.delta.catalogcrawler.crawl.model.PageUnitStatus;
import com.delta.catalogcrawler.crawl.stage.StageKind;

import java.time.Instant;

public record UnitStatusEvent(
    StageKind stage,
    int unitId,
    PageUnitStatus previous,
    PageUnitStatus status,
    int attempt,
    String error,
    Instant at
) implements CrawlEvent {
    @Override
    public boolean boundary() {
        return false;
    }
}
