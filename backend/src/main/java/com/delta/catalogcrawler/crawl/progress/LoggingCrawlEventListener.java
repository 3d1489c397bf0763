package com.delta.catalogcrawler.crawl.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingCrawlEventListener implements CrawlEventListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingCrawlEventListener.class);

    private final ObjectMapper objectMapper;

    public LoggingCrawlEventListener(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void onEvent(CrawlEvent event) {
        if (event instanceof ProgressSnapshot) {
            if (log.isDebugEnabled()) {
                log.debug("progress {}", toJson(event));
            }
            return;
        }
        log.info("{} {}", event.getClass().getSimpleName(), toJson(event));
    }

    private String toJson(CrawlEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("Unable to serialise {}", event.getClass().getSimpleName(), e);
            return String.valueOf(event);
        }
    }
}
