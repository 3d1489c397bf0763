package com.delta.catalogcrawler.crawl.model;

public record SitePageSlot(
    int sitePage,
    int slotInPage
) {
}
