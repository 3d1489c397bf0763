package com.delta.catalogcrawler.crawl.model;

import java.time.Instant;
import java.util.Map;

public record RecordDetail(
    String url,
    String title,
    Map<String, String> attributes,
    Instant fetchedAt
) {
    public RecordDetail {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
