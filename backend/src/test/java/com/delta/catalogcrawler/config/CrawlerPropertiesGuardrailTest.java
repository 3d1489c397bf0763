package com.delta.catalogcrawler.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("catalog-crawler/0.1"));
    }

    @Test
    void concurrencyRetriesAndDelaysAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setGlobalConcurrency(0);
        properties.setPerHostDelayMs(-10);
        properties.getList().setInitialConcurrency(0);
        properties.getList().setMaxRetries(-2);
        properties.getList().setPageLimit(-5);
        properties.getTotals().setMaxAttempts(0);
        properties.getGap().setMaxConcurrentPages(0);
        properties.getGap().setMergeDistance(0);
        properties.getCatalog().setPageSize(0);

        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(1, properties.getPerHostDelayMs());
        assertEquals(1, properties.getList().getInitialConcurrency());
        assertEquals(0, properties.getList().getMaxRetries());
        assertEquals(0, properties.getList().getPageLimit());
        assertEquals(1, properties.getTotals().getMaxAttempts());
        assertEquals(1, properties.getGap().getMaxConcurrentPages());
        assertEquals(1, properties.getGap().getMergeDistance());
        assertEquals(1, properties.getCatalog().getPageSize());
    }

    @Test
    void listingUrlsJoinBaseAndTemplate() {
        CrawlerProperties.Catalog catalog = new CrawlerProperties.Catalog();
        catalog.setBaseUrl("https://shop.example/");
        catalog.setListingPathTemplate("/catalog/page/{page}");
        catalog.setEntryPath("catalog");

        assertEquals("https://shop.example/catalog/page/7", catalog.listingUrl(7));
        assertEquals("https://shop.example/catalog", catalog.entryUrl());

        catalog.setEntryPath("https://mirror.example/start");
        assertEquals("https://mirror.example/start", catalog.entryUrl());
    }
}
