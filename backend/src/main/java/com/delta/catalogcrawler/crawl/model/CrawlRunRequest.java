package com.delta.catalogcrawler.crawl.model;

public record CrawlRunRequest(
    Integer pageLimit,
    Boolean collectDetails
) {
}
