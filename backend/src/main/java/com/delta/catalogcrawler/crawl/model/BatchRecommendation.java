package com.delta.catalogcrawler.crawl.model;

public record BatchRecommendation(
    int totalPagesToCrawl,
    int batchSize,
    int totalBatches,
    int estimatedMinutes,
    int recommendedConcurrency
) {
}
