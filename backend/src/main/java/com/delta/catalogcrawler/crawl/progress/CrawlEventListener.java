package com.delta.catalogcrawler.crawl.progress;

@FunctionalInterface
public interface CrawlEventListener {
    void onEvent(CrawlEvent event);
}
