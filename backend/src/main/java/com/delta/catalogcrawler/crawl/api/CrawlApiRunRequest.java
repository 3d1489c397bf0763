package com.delta.catalogcrawler.crawl.api;

public record CrawlApiRunRequest(
    Integer pageLimit,
    Boolean collectDetails
) {
}
