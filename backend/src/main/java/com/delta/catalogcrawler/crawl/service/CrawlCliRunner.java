package com.delta.catalogcrawler.crawl.service;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.CrawlRunRequest;
import com.delta.catalogcrawler.crawl.model.CrawlRunSummary;
import com.delta.catalogcrawler.crawl.model.FailedUnitReport;
import com.delta.catalogcrawler.crawl.model.GapCollectionResult;
import com.delta.catalogcrawler.crawl.model.GapReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        CrawlOrchestratorService crawlOrchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        String mode = properties.getCli().getMode().toLowerCase(Locale.ROOT);
        int exitCode;
        switch (mode) {
            case "gaps" -> {
                GapReport report = crawlOrchestratorService.detectGaps();
                exitCode = 0;
                log.info("Gap detection complete: {} pages incomplete", report.missingPages().size());
            }
            case "repair" -> {
                GapCollectionResult result = crawlOrchestratorService.collectGaps(null);
                exitCode = result.failedPageIds().isEmpty() && !result.cancelled() ? 0 : 1;
                log.info(
                    "Gap repair complete: collected={}, skipped={}, failed={}, errors={}",
                    result.collected(),
                    result.skipped(),
                    result.failed(),
                    result.errors()
                );
            }
            case "crawl" -> {
                CrawlRunSummary summary = crawlOrchestratorService.run(
                    new CrawlRunRequest(properties.getCli().getPageLimit(), null)
                );
                exitCode = summary.status().startsWith("COMPLETED") ? 0 : 1;
                log.info(
                    "Crawl run {} completed with status {}: pages={}/{}, records={}, details={}, saved={}",
                    summary.crawlRunId(),
                    summary.status(),
                    summary.pagesSucceeded(),
                    summary.pagesAttempted(),
                    summary.recordsCollected(),
                    summary.detailsCollected(),
                    summary.saved()
                );
                for (FailedUnitReport failure : summary.failedPages()) {
                    log.info(
                        "Failed pageId {} (site page {}): {} after {} attempts, errors={}",
                        failure.unitId(),
                        failure.sitePage(),
                        failure.status(),
                        failure.attempts(),
                        failure.errors()
                    );
                }
            }
            default -> throw new IllegalArgumentException("Unknown crawler.cli.mode: " + mode);
        }

        if (properties.getCli().isExitAfterRun()) {
            int finalExitCode = exitCode;
            int code = SpringApplication.exit(applicationContext, () -> finalExitCode);
            System.exit(code);
        }
    }
}
