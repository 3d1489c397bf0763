package com.delta.catalogcrawler.crawl.stage;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.concurrent.CancelToken;
import com.delta.catalogcrawler.crawl.concurrent.ConcurrencyPool;
import com.delta.catalogcrawler.crawl.fetch.CrawlException;
import com.delta.catalogcrawler.crawl.fetch.FetchCapability;
import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.DetailCollectionResult;
import com.delta.catalogcrawler.crawl.model.FailedUnitReport;
import com.delta.catalogcrawler.crawl.model.PageUnitStatus;
import com.delta.catalogcrawler.crawl.model.RecordDetail;
import com.delta.catalogcrawler.crawl.progress.CrawlEventListener;
import com.delta.catalogcrawler.crawl.progress.RetryCycleEvent;
import com.delta.catalogcrawler.crawl.progress.StageSummaryEvent;
import com.delta.catalogcrawler.crawl.util.FetchErrorClassifier;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;

/**
 * Stage two: one unit per discovered record. Unlike the listing stage, leftover failures are reported but do not
 * void the details that did arrive.
 */
public class DetailCollectionStage {
    private final FetchCapability fetchCapability;
    private final ConcurrencyPool pool;
    private final CrawlerProperties.DetailStage settings;
    private final Clock clock;
    private final CrawlEventListener listener;
    private final Map<Integer, RecordDetail> details = new ConcurrentHashMap<>();

    public DetailCollectionStage(
        FetchCapability fetchCapability,
        ConcurrencyPool pool,
        CrawlerProperties.DetailStage settings,
        Clock clock,
        CrawlEventListener listener
    ) {
        this.fetchCapability = fetchCapability;
        this.pool = pool;
        this.settings = settings;
        this.clock = clock;
        this.listener = listener == null ? event -> { } : listener;
    }

    public DetailCollectionResult collect(List<CatalogRecord> records, CancelToken cancelToken) {
        if (records == null || records.isEmpty()) {
            return DetailCollectionResult.empty();
        }
        CancelToken token = cancelToken == null ? CancelToken.create() : cancelToken;
        List<Integer> unitIds = IntStream.range(0, records.size()).boxed().toList();
        StageState state = new StageState(StageKind.DETAIL, unitIds, settings.getMaxRetries(), clock, listener);
        state.setStage(StagePhase.COLLECTING, "collecting details for " + records.size() + " records");
        pool.run(unitIds, (id, cancel) -> collectDetail(id, records.get(id), state, cancel), settings.getInitialConcurrency(), token);

        while (!token.isCancelled() && state.canRetry()) {
            List<Integer> outstanding = state.outstandingUnitIds();
            state.setStage(
                StagePhase.RETRYING,
                outstanding.size() + " details missing, scheduling retry cycle " + (state.retryCycle() + 1)
            );
            listener.onEvent(new RetryCycleEvent(
                StageKind.DETAIL,
                state.retryCycle(),
                state.maxRetries(),
                outstanding.size(),
                settings.getRetryConcurrency(),
                clock.instant()
            ));
            if (!token.sleep(Duration.ofMillis(settings.getRetryDelayMs()))) {
                break;
            }
            state.setStage(
                StagePhase.COLLECTING,
                "retry cycle " + state.retryCycle() + " collecting " + outstanding.size() + " details"
            );
            pool.run(outstanding, (id, cancel) -> collectDetail(id, records.get(id), state, cancel), settings.getRetryConcurrency(), token);
        }

        if (token.isCancelled()) {
            state.markCancelled();
        }
        int missing = state.totalUnits() - state.count(PageUnitStatus.SUCCESS);
        state.setStage(
            StagePhase.PROCESSING,
            missing == 0 ? "all details collected" : missing + " details unresolved"
        );
        List<RecordDetail> collected = new ArrayList<>();
        for (Integer id : unitIds) {
            RecordDetail detail = details.get(id);
            if (detail != null && state.unit(id).status() == PageUnitStatus.SUCCESS) {
                collected.add(detail);
            }
        }
        List<FailedUnitReport> failures = state.failureReports(null, id -> records.get(id).url());
        boolean cancelled = state.isCancelled();
        if (cancelled) {
            state.setStage(StagePhase.FAILED, "cancelled: " + token.reason());
        } else {
            state.setStage(StagePhase.COMPLETE, collected.size() + " details, " + failures.size() + " failed");
        }

        DetailCollectionResult result = new DetailCollectionResult(
            collected,
            state.totalUnits(),
            state.attemptedUnits(),
            state.count(PageUnitStatus.SUCCESS),
            state.successRate(),
            state.retryCycle(),
            failures,
            cancelled
        );
        listener.onEvent(new StageSummaryEvent(
            StageKind.DETAIL,
            result.totalUnits(),
            result.attemptedUnits(),
            result.succeededUnits(),
            result.successRate(),
            result.retryCycles(),
            false,
            cancelled,
            state.elapsed(),
            failures,
            clock.instant()
        ));
        details.clear();
        return result;
    }

    private PageUnitStatus collectDetail(int id, CatalogRecord record, StageState state, CancelToken token) {
        token.throwIfCancelled();
        int attempt = state.beginAttempt(id);
        try {
            RecordDetail detail = fetchCapability.fetchRecordDetail(record.url(), token, attempt);
            details.merge(id, detail, DetailCollectionStage::richer);
            if (details.get(id).attributes().isEmpty()) {
                state.finishAttempt(id, PageUnitStatus.INCOMPLETE, "no attributes on " + record.url());
                return PageUnitStatus.INCOMPLETE;
            }
            state.finishAttempt(id, PageUnitStatus.SUCCESS, null);
            return PageUnitStatus.SUCCESS;
        } catch (RuntimeException e) {
            CrawlException failure = FetchErrorClassifier.toCrawlException(e, "detail " + record.url());
            state.finishAttempt(id, PageUnitStatus.FAILED, failure.kind() + " " + failure.getMessage());
            return PageUnitStatus.FAILED;
        }
    }

    private static RecordDetail richer(RecordDetail previous, RecordDetail next) {
        return next.attributes().size() >= previous.attributes().size() ? next : previous;
    }
}
