package com.delta.catalogcrawler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "catalog-crawler/0.1 (+contact)";

    private String userAgent;
    private int perHostDelayMs = 1000;
    private int perHostConcurrency = 2;
    private int globalConcurrency = 5;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private Catalog catalog = new Catalog();
    private Fetch fetch = new Fetch();
    private Totals totals = new Totals();
    private ListStage list = new ListStage();
    private DetailStage detail = new DetailStage();
    private Gap gap = new Gap();
    private Progress progress = new Progress();
    private Run run = new Run();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getPerHostConcurrency() {
        return Math.max(1, perHostConcurrency);
    }

    public void setPerHostConcurrency(int perHostConcurrency) {
        this.perHostConcurrency = Math.max(1, perHostConcurrency);
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Totals getTotals() {
        return totals;
    }

    public void setTotals(Totals totals) {
        this.totals = totals;
    }

    public ListStage getList() {
        return list;
    }

    public void setList(ListStage list) {
        this.list = list;
    }

    public DetailStage getDetail() {
        return detail;
    }

    public void setDetail(DetailStage detail) {
        this.detail = detail;
    }

    public Gap getGap() {
        return gap;
    }

    public void setGap(Gap gap) {
        this.gap = gap;
    }

    public Progress getProgress() {
        return progress;
    }

    public void setProgress(Progress progress) {
        this.progress = progress;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Catalog {
        private String baseUrl = "http://localhost:8081";
        private String listingPathTemplate = "/catalog/page/{page}";
        private String entryPath = "/catalog/page/1";
        private String recordSelector = "article";
        private String linkSelector = "a[href]";
        private String titleSelector = "h2, h3";
        private String paginationSelector = ".pagination a, a.page-numbers";
        private String detailTitleSelector = "h1";
        private String detailFieldSelector = "table tr";
        private int pageSize = 12;
        private boolean newestFirst = true;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getListingPathTemplate() {
            return listingPathTemplate;
        }

        public void setListingPathTemplate(String listingPathTemplate) {
            this.listingPathTemplate = listingPathTemplate;
        }

        public String getEntryPath() {
            return entryPath;
        }

        public void setEntryPath(String entryPath) {
            this.entryPath = entryPath;
        }

        public String getRecordSelector() {
            return recordSelector;
        }

        public void setRecordSelector(String recordSelector) {
            this.recordSelector = recordSelector;
        }

        public String getLinkSelector() {
            return linkSelector;
        }

        public void setLinkSelector(String linkSelector) {
            this.linkSelector = linkSelector;
        }

        public String getTitleSelector() {
            return titleSelector;
        }

        public void setTitleSelector(String titleSelector) {
            this.titleSelector = titleSelector;
        }

        public String getPaginationSelector() {
            return paginationSelector;
        }

        public void setPaginationSelector(String paginationSelector) {
            this.paginationSelector = paginationSelector;
        }

        public String getDetailTitleSelector() {
            return detailTitleSelector;
        }

        public void setDetailTitleSelector(String detailTitleSelector) {
            this.detailTitleSelector = detailTitleSelector;
        }

        public String getDetailFieldSelector() {
            return detailFieldSelector;
        }

        public void setDetailFieldSelector(String detailFieldSelector) {
            this.detailFieldSelector = detailFieldSelector;
        }

        public int getPageSize() {
            return Math.max(1, pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = Math.max(1, pageSize);
        }

        public boolean isNewestFirst() {
            return newestFirst;
        }

        public void setNewestFirst(boolean newestFirst) {
            this.newestFirst = newestFirst;
        }

        public String listingUrl(int sitePage) {
            return join(baseUrl, listingPathTemplate.replace("{page}", Integer.toString(sitePage)));
        }

        public String entryUrl() {
            return join(baseUrl, entryPath);
        }

        private static String join(String base, String path) {
            if (path == null || path.isBlank()) {
                return base;
            }
            if (path.startsWith("http://") || path.startsWith("https://")) {
                return path;
            }
            String left = base == null ? "" : base.replaceAll("/+$", "");
            return path.startsWith("/") ? left + path : left + "/" + path;
        }
    }

    public static class Fetch {
        private String strategy = "http";
        private boolean fallbackEnabled = true;
        private int jsoupTimeoutMs = 20000;

        public String getStrategy() {
            return strategy == null || strategy.isBlank() ? "http" : strategy.trim();
        }

        public void setStrategy(String strategy) {
            this.strategy = strategy;
        }

        public boolean isFallbackEnabled() {
            return fallbackEnabled;
        }

        public void setFallbackEnabled(boolean fallbackEnabled) {
            this.fallbackEnabled = fallbackEnabled;
        }

        public int getJsoupTimeoutMs() {
            return Math.max(1, jsoupTimeoutMs);
        }

        public void setJsoupTimeoutMs(int jsoupTimeoutMs) {
            this.jsoupTimeoutMs = Math.max(1, jsoupTimeoutMs);
        }
    }

    public static class Totals {
        private int cacheTtlSeconds = 300;
        private int maxAttempts = 3;
        private int retryDelayMs = 1000;

        public int getCacheTtlSeconds() {
            return Math.max(0, cacheTtlSeconds);
        }

        public void setCacheTtlSeconds(int cacheTtlSeconds) {
            this.cacheTtlSeconds = Math.max(0, cacheTtlSeconds);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getRetryDelayMs() {
            return Math.max(0, retryDelayMs);
        }

        public void setRetryDelayMs(int retryDelayMs) {
            this.retryDelayMs = Math.max(0, retryDelayMs);
        }
    }

    public static class Stage {
        private int initialConcurrency = 5;
        private int retryConcurrency = 1;
        private int maxRetries = 3;
        private int retryDelayMs = 1000;

        public int getInitialConcurrency() {
            return Math.max(1, initialConcurrency);
        }

        public void setInitialConcurrency(int initialConcurrency) {
            this.initialConcurrency = Math.max(1, initialConcurrency);
        }

        public int getRetryConcurrency() {
            return Math.max(1, retryConcurrency);
        }

        public void setRetryConcurrency(int retryConcurrency) {
            this.retryConcurrency = Math.max(1, retryConcurrency);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryDelayMs() {
            return Math.max(0, retryDelayMs);
        }

        public void setRetryDelayMs(int retryDelayMs) {
            this.retryDelayMs = Math.max(0, retryDelayMs);
        }
    }

    public static class ListStage extends Stage {
        private int pageLimit = 0;
        private Batch batch = new Batch();

        public int getPageLimit() {
            return Math.max(0, pageLimit);
        }

        public void setPageLimit(int pageLimit) {
            this.pageLimit = Math.max(0, pageLimit);
        }

        public Batch getBatch() {
            return batch;
        }

        public void setBatch(Batch batch) {
            this.batch = batch;
        }
    }

    public static class Batch {
        private boolean enabled = false;
        private int batchSize = 30;
        private int batchDelayMs = 2000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getBatchDelayMs() {
            return Math.max(0, batchDelayMs);
        }

        public void setBatchDelayMs(int batchDelayMs) {
            this.batchDelayMs = Math.max(0, batchDelayMs);
        }
    }

    public static class DetailStage extends Stage {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Gap {
        private int maxConcurrentPages = 3;
        private int delayBetweenPagesMs = 1000;
        private boolean prioritizePartialPages = true;
        private int mergeDistance = 3;
        private int fallbackMargin = 50;
        private int batchPages = 10;
        private int secondsPerPage = 5;

        public int getMaxConcurrentPages() {
            return Math.max(1, maxConcurrentPages);
        }

        public void setMaxConcurrentPages(int maxConcurrentPages) {
            this.maxConcurrentPages = Math.max(1, maxConcurrentPages);
        }

        public int getDelayBetweenPagesMs() {
            return Math.max(0, delayBetweenPagesMs);
        }

        public void setDelayBetweenPagesMs(int delayBetweenPagesMs) {
            this.delayBetweenPagesMs = Math.max(0, delayBetweenPagesMs);
        }

        public boolean isPrioritizePartialPages() {
            return prioritizePartialPages;
        }

        public void setPrioritizePartialPages(boolean prioritizePartialPages) {
            this.prioritizePartialPages = prioritizePartialPages;
        }

        public int getMergeDistance() {
            return Math.max(1, mergeDistance);
        }

        public void setMergeDistance(int mergeDistance) {
            this.mergeDistance = Math.max(1, mergeDistance);
        }

        public int getFallbackMargin() {
            return Math.max(0, fallbackMargin);
        }

        public void setFallbackMargin(int fallbackMargin) {
            this.fallbackMargin = Math.max(0, fallbackMargin);
        }

        public int getBatchPages() {
            return Math.max(1, batchPages);
        }

        public void setBatchPages(int batchPages) {
            this.batchPages = Math.max(1, batchPages);
        }

        public int getSecondsPerPage() {
            return Math.max(1, secondsPerPage);
        }

        public void setSecondsPerPage(int secondsPerPage) {
            this.secondsPerPage = Math.max(1, secondsPerPage);
        }
    }

    public static class Progress {
        private int throttleMs = 500;

        public int getThrottleMs() {
            return Math.max(0, throttleMs);
        }

        public void setThrottleMs(int throttleMs) {
            this.throttleMs = Math.max(0, throttleMs);
        }
    }

    public static class Run {
        private boolean autoSave = true;
        private int estimatedMsPerPage = 5000;

        public boolean isAutoSave() {
            return autoSave;
        }

        public void setAutoSave(boolean autoSave) {
            this.autoSave = autoSave;
        }

        public int getEstimatedMsPerPage() {
            return Math.max(1, estimatedMsPerPage);
        }

        public void setEstimatedMsPerPage(int estimatedMsPerPage) {
            this.estimatedMsPerPage = Math.max(1, estimatedMsPerPage);
        }
    }

    public static class Cli {
        private boolean run = false;
        private String mode = "crawl";
        private int pageLimit = 0;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getMode() {
            return mode == null || mode.isBlank() ? "crawl" : mode.trim();
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public int getPageLimit() {
            return Math.max(0, pageLimit);
        }

        public void setPageLimit(int pageLimit) {
            this.pageLimit = Math.max(0, pageLimit);
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
