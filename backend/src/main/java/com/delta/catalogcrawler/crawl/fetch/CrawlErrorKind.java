package com.delta.catalogcrawler.crawl.fetch;

public enum CrawlErrorKind {
    TIMEOUT,
    ABORTED,
    NAVIGATION,
    EXTRACTION,
    INITIALIZATION,
    UNKNOWN
}
