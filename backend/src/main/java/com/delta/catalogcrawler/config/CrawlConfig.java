package com.delta.catalogcrawler.config;

import com.delta.catalogcrawler.crawl.fetch.FallbackFetchCapability;
import com.delta.catalogcrawler.crawl.fetch.FetchCapability;
import com.delta.catalogcrawler.crawl.fetch.HttpFetchCapability;
import com.delta.catalogcrawler.crawl.fetch.JsoupFetchCapability;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CrawlConfig {

    @Bean(name = "crawlExecutor", destroyMethod = "shutdown")
    public ExecutorService crawlExecutor(CrawlerProperties properties) {
        int size = Math.max(
            properties.getGlobalConcurrency(),
            Math.max(properties.getList().getInitialConcurrency(), properties.getDetail().getInitialConcurrency())
        );
        return Executors.newFixedThreadPool(Math.max(size, properties.getGap().getMaxConcurrentPages()));
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(CrawlerProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "crawlRunExecutor", destroyMethod = "shutdown")
    public ExecutorService crawlRunExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Primary
    public FetchCapability fetchCapability(
        CrawlerProperties properties,
        HttpFetchCapability httpFetchCapability,
        JsoupFetchCapability jsoupFetchCapability
    ) {
        String strategy = properties.getFetch().getStrategy().toLowerCase(Locale.ROOT);
        FetchCapability primary = strategy.equals("jsoup") ? jsoupFetchCapability : httpFetchCapability;
        FetchCapability secondary = primary == httpFetchCapability ? jsoupFetchCapability : httpFetchCapability;
        if (!properties.getFetch().isFallbackEnabled()) {
            return primary;
        }
        return new FallbackFetchCapability(primary, secondary);
    }
}
