package com.delta.catalogcrawler.crawl.api;

import com.delta.catalogcrawler.crawl.gap.GapCollector;
import com.delta.catalogcrawler.crawl.gap.GapReportCsvWriter;
import com.delta.catalogcrawler.crawl.model.CrawlRunRequest;
import com.delta.catalogcrawler.crawl.model.CrawlRunSummary;
import com.delta.catalogcrawler.crawl.model.CrawlRunView;
import com.delta.catalogcrawler.crawl.model.CrawlStatusSummary;
import com.delta.catalogcrawler.crawl.model.FailedUnitReport;
import com.delta.catalogcrawler.crawl.model.GapCollectionOptions;
import com.delta.catalogcrawler.crawl.model.GapCollectionResult;
import com.delta.catalogcrawler.crawl.model.GapReport;
import com.delta.catalogcrawler.crawl.progress.ProgressSnapshot;
import com.delta.catalogcrawler.crawl.service.CrawlOrchestratorService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class CrawlController {
    private final CrawlOrchestratorService crawlOrchestratorService;
    private final GapCollector gapCollector;
    private final GapReportCsvWriter gapReportCsvWriter;

    public CrawlController(
        CrawlOrchestratorService crawlOrchestratorService,
        GapCollector gapCollector,
        GapReportCsvWriter gapReportCsvWriter
    ) {
        this.crawlOrchestratorService = crawlOrchestratorService;
        this.gapCollector = gapCollector;
        this.gapReportCsvWriter = gapReportCsvWriter;
    }

    @PostMapping("/crawl/run")
    public CrawlRunSummary runCrawl(@RequestBody(required = false) CrawlApiRunRequest request) {
        return crawlOrchestratorService.run(toRunRequest(request));
    }

    @PostMapping("/crawl/start")
    public Map<String, Object> startCrawl(@RequestBody(required = false) CrawlApiRunRequest request) {
        long crawlRunId = crawlOrchestratorService.startAsync(toRunRequest(request));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("crawlRunId", crawlRunId);
        response.put("status", "RUNNING");
        return response;
    }

    @PostMapping("/crawl/stop")
    public Map<String, Object> stopCrawl(@RequestParam(name = "reason", required = false) String reason) {
        Long activeRunId = crawlOrchestratorService.activeRunId();
        boolean stopped = crawlOrchestratorService.stop(reason);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("stopped", stopped);
        response.put("crawlRunId", activeRunId);
        return response;
    }

    @GetMapping("/crawl/status")
    public CrawlStatusSummary status() {
        return crawlOrchestratorService.checkStatus();
    }

    @GetMapping("/crawl/progress")
    public ResponseEntity<ProgressSnapshot> progress() {
        ProgressSnapshot snapshot = crawlOrchestratorService.latestProgress();
        if (snapshot == null) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(snapshot);
    }

    @GetMapping("/crawl/runs")
    public List<CrawlRunView> recentRuns(@RequestParam(name = "limit", required = false, defaultValue = "20") int limit) {
        return crawlOrchestratorService.recentRuns(limit);
    }

    @GetMapping("/crawl/runs/{crawlRunId}/failures")
    public List<FailedUnitReport> runFailures(@PathVariable("crawlRunId") long crawlRunId) {
        return crawlOrchestratorService.failedPages(crawlRunId);
    }

    @GetMapping("/gaps")
    public GapReport gaps(
        @RequestParam(name = "start", required = false) Integer start,
        @RequestParam(name = "end", required = false) Integer end
    ) {
        return detect(start, end);
    }

    @GetMapping(value = "/gaps/export", produces = "text/csv")
    public ResponseEntity<String> exportGaps(
        @RequestParam(name = "start", required = false) Integer start,
        @RequestParam(name = "end", required = false) Integer end
    ) {
        String csv = gapReportCsvWriter.write(detect(start, end));
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"gap-report.csv\"")
            .contentType(MediaType.parseMediaType("text/csv"))
            .body(csv);
    }

    @PostMapping("/gaps/collect")
    public GapCollectionResult collectGaps(@RequestBody(required = false) GapCollectApiRequest request) {
        return crawlOrchestratorService.collectGaps(toOptions(request));
    }

    @PostMapping("/gaps/pages/{pageId}/collect")
    public GapCollectionResult collectPageGap(
        @PathVariable("pageId") int pageId,
        @RequestBody(required = false) GapCollectApiRequest request
    ) {
        return crawlOrchestratorService.collectPageGap(pageId, toOptions(request));
    }

    private GapReport detect(Integer start, Integer end) {
        if (start == null && end == null) {
            return crawlOrchestratorService.detectGaps();
        }
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end must be given together");
        }
        return crawlOrchestratorService.detectGaps(start, end);
    }

    private static CrawlRunRequest toRunRequest(CrawlApiRunRequest request) {
        if (request == null) {
            return new CrawlRunRequest(null, null);
        }
        return new CrawlRunRequest(request.pageLimit(), request.collectDetails());
    }

    private GapCollectionOptions toOptions(GapCollectApiRequest request) {
        GapCollectionOptions defaults = gapCollector.defaultOptions();
        if (request == null) {
            return defaults;
        }
        return new GapCollectionOptions(
            request.maxConcurrentPages() == null ? defaults.maxConcurrentPages() : request.maxConcurrentPages(),
            request.delayBetweenPagesMs() == null ? defaults.delayBetweenPagesMs() : request.delayBetweenPagesMs(),
            request.prioritizePartialPages() == null ? defaults.prioritizePartialPages() : request.prioritizePartialPages()
        );
    }
}
