package com.delta.catalogcrawler.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.time.Instant;

/**
 * Raised when a crawl or gap run is requested while another one still holds the engine.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class ActiveCrawlRunException extends RuntimeException {
    private final Long activeRunId;

    public ActiveCrawlRunException(Long activeRunId, Instant startedAt) {
        super("Active crawl run in progress (id=" + (activeRunId == null ? "pending" : activeRunId)
            + ", startedAt=" + (startedAt == null ? "unknown" : startedAt) + ")");
        this.activeRunId = activeRunId;
    }

    /** Null while the competing run is still inserting its row. */
    public Long activeRunId() {
        return activeRunId;
    }
}
