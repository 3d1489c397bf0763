package com.delta.catalogcrawler.crawl.stage;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.concurrent.CancelToken;
import com.delta.catalogcrawler.crawl.concurrent.ConcurrencyPool;
import com.delta.catalogcrawler.crawl.fetch.SiteTotalsCache;
import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.FailedUnitReport;
import com.delta.catalogcrawler.crawl.model.ListCollectionResult;
import com.delta.catalogcrawler.crawl.model.PageRange;
import com.delta.catalogcrawler.crawl.model.PageUnitStatus;
import com.delta.catalogcrawler.crawl.model.SiteTotalsSnapshot;
import com.delta.catalogcrawler.crawl.progress.CrawlEvent;
import com.delta.catalogcrawler.crawl.progress.CrawlEventListener;
import com.delta.catalogcrawler.crawl.progress.StageTransitionEvent;
import com.delta.catalogcrawler.crawl.progress.UnitStatusEvent;
import com.delta.catalogcrawler.crawl.support.InMemoryRecordStore;
import com.delta.catalogcrawler.crawl.support.ScriptedCatalogSite;
import com.delta.catalogcrawler.crawl.util.PageIndexMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class ListCollectionStageTest {
    private static final int PAGE_SIZE = 12;

    private final Clock clock = Clock.systemUTC();
    private final PageIndexMapper mapper = new PageIndexMapper(PAGE_SIZE);
    private final List<CrawlEvent> events = new CopyOnWriteArrayList<>();
    private ExecutorService executor;
    private ConcurrencyPool pool;
    private InMemoryRecordStore store;
    private CrawlerProperties.ListStage settings;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        pool = new ConcurrencyPool(executor);
        store = new InMemoryRecordStore();
        settings = new CrawlerProperties.ListStage();
        settings.setInitialConcurrency(3);
        settings.setRetryConcurrency(1);
        settings.setMaxRetries(3);
        settings.setRetryDelayMs(0);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void unlimitedRunCoversEveryPageAndBoundaryPageExpectsLastPageCount() {
        ScriptedCatalogSite site = new ScriptedCatalogSite(PAGE_SIZE, 10, 5);

        ListCollectionResult result = stage(site, events::add).collect(0, CancelToken.create());

        assertThat(result.range()).isEqualTo(new PageRange(9, 0));
        assertThat(result.totalUnits()).isEqualTo(10);
        assertThat(result.succeededUnits()).isEqualTo(10);
        assertThat(result.stageFailed()).isFalse();
        assertThat(result.failedPages()).isEmpty();
        assertThat(result.records()).hasSize(9 * PAGE_SIZE + 5);
        assertThat(result.records()).extracting(CatalogRecord::url).doesNotHaveDuplicates();
        CatalogRecord oldest = result.records().stream()
            .filter(record -> record.url().equals(ScriptedCatalogSite.recordUrl(1, 0)))
            .findFirst()
            .orElseThrow();
        assertThat(oldest.pageId()).isEqualTo(9);
        assertThat(oldest.indexInPage()).isZero();
        assertThat(oldest.sitePage()).isEqualTo(1);
        assertThat(site.listingCalls(1)).isEqualTo(1);
        assertThat(lastTransition().to()).isEqualTo(StagePhase.COMPLETE);
    }

    @Test
    void pageFailingTwiceSucceedsInLaterRetryCycle() {
        ScriptedCatalogSite site = new ScriptedCatalogSite(PAGE_SIZE, 10, 5).failListing(3, 2);

        ListCollectionResult result = stage(site, events::add).collect(0, CancelToken.create());

        assertThat(result.stageFailed()).isFalse();
        assertThat(result.retryCycles()).isEqualTo(2);
        assertThat(site.listingCalls(3)).isEqualTo(3);
        assertThat(result.records()).hasSize(9 * PAGE_SIZE + 5);
        assertThat(events)
            .filteredOn(UnitStatusEvent.class::isInstance)
            .map(UnitStatusEvent.class::cast)
            .filteredOn(event -> event.unitId() == 7 && event.status() == PageUnitStatus.SUCCESS)
            .extracting(UnitStatusEvent::attempt)
            .containsExactly(3);
    }

    @Test
    void unresolvedPageFailsStageButKeepsCollectedRecords() {
        settings.setMaxRetries(2);
        ScriptedCatalogSite site = new ScriptedCatalogSite(PAGE_SIZE, 10, 5).alwaysFailListing(4);

        ListCollectionResult result = stage(site, events::add).collect(0, CancelToken.create());

        assertThat(result.stageFailed()).isTrue();
        assertThat(result.cancelled()).isFalse();
        assertThat(result.records()).hasSize(8 * PAGE_SIZE + 5);
        assertThat(result.failedPages()).hasSize(1);
        FailedUnitReport failure = result.failedPages().get(0);
        assertThat(failure.unitId()).isEqualTo(6);
        assertThat(failure.sitePage()).isEqualTo(4);
        assertThat(failure.status()).isEqualTo(PageUnitStatus.FAILED);
        assertThat(failure.attempts()).isEqualTo(3);
        assertThat(failure.errors()).hasSize(3);
        assertThat(failure.errors().get(0)).startsWith("Attempt 1:").contains("NAVIGATION");
        assertThat(lastTransition().to()).isEqualTo(StagePhase.FAILED);
    }

    @Test
    void partialListingIsCompletedByRetryWithPositionsFromFullFetch() {
        ScriptedCatalogSite site = new ScriptedCatalogSite(PAGE_SIZE, 1, PAGE_SIZE).dropListingSlots(1, 1, 3);

        ListCollectionResult result = stage(site, events::add).collect(0, CancelToken.create());

        assertThat(result.stageFailed()).isFalse();
        assertThat(result.retryCycles()).isEqualTo(1);
        assertThat(site.listingCalls(1)).isEqualTo(2);
        assertThat(result.records()).hasSize(PAGE_SIZE);
        for (CatalogRecord record : result.records()) {
            assertThat(record.pageId()).isZero();
            assertThat(record.url()).isEqualTo(ScriptedCatalogSite.recordUrl(1, record.indexInPage()));
        }
        assertThat(events)
            .filteredOn(UnitStatusEvent.class::isInstance)
            .map(UnitStatusEvent.class::cast)
            .filteredOn(event -> event.unitId() == 0 && event.attempt() == 1)
            .extracting(UnitStatusEvent::status)
            .contains(PageUnitStatus.INCOMPLETE);
    }

    @Test
    void pageThatStaysIncompleteFailsStage() {
        settings.setMaxRetries(2);
        ScriptedCatalogSite site = new ScriptedCatalogSite(PAGE_SIZE, 1, PAGE_SIZE).alwaysDropListingSlots(1, 3, 7);

        ListCollectionResult result = stage(site, events::add).collect(0, CancelToken.create());

        assertThat(result.stageFailed()).isTrue();
        assertThat(site.listingCalls(1)).isEqualTo(3);
        assertThat(result.records()).hasSize(PAGE_SIZE - 2);
        assertThat(result.failedPages()).hasSize(1);
        FailedUnitReport failure = result.failedPages().get(0);
        assertThat(failure.status()).isEqualTo(PageUnitStatus.INCOMPLETE);
        assertThat(failure.attempts()).isEqualTo(3);
        assertThat(failure.errors()).allSatisfy(error -> assertThat(error).contains("collected 10 of 12"));
        assertThat(lastTransition().to()).isEqualTo(StagePhase.FAILED);
    }

    @Test
    void pageLimitContinuesAfterAlreadyCollectedRecords() {
        store.fillPage(9, 5);
        ScriptedCatalogSite site = new ScriptedCatalogSite(PAGE_SIZE, 10, 5);

        ListCollectionResult result = stage(site, events::add).collect(3, CancelToken.create());

        assertThat(result.range()).isEqualTo(new PageRange(8, 6));
        assertThat(result.records()).hasSize(3 * PAGE_SIZE);
        assertThat(site.listingCalls(1)).isZero();
        assertThat(site.listingCalls(2)).isEqualTo(1);
        assertThat(site.listingCalls(5)).isZero();
    }

    @Test
    void fullyCollectedCatalogYieldsEmptyRange() {
        for (int i = 0; i < 9 * PAGE_SIZE + 5; i++) {
            store.put(i / PAGE_SIZE, i % PAGE_SIZE);
        }
        ScriptedCatalogSite site = new ScriptedCatalogSite(PAGE_SIZE, 10, 5);

        ListCollectionResult result = stage(site, events::add).collect(0, CancelToken.create());

        assertThat(result.isEmptyRange()).isTrue();
        assertThat(site.totalListingCalls()).isZero();
    }

    @Test
    void cancellationStopsSchedulingAndReturnsPartialRecords() {
        settings.setInitialConcurrency(1);
        CancelToken token = CancelToken.create();
        ScriptedCatalogSite site = new ScriptedCatalogSite(PAGE_SIZE, 10, 5);
        CrawlEventListener cancelOnFirstSuccess = event -> {
            events.add(event);
            if (event instanceof UnitStatusEvent unit && unit.status() == PageUnitStatus.SUCCESS) {
                token.cancel("test_stop");
            }
        };

        ListCollectionResult result = stage(site, cancelOnFirstSuccess).collect(0, token);

        assertThat(result.cancelled()).isTrue();
        assertThat(result.records()).hasSize(5);
        assertThat(site.totalListingCalls()).isEqualTo(1);
        assertThat(result.retryCycles()).isZero();
        assertThat(lastTransition().to()).isEqualTo(StagePhase.FAILED);
        assertThat(lastTransition().reason()).contains("test_stop");
    }

    @Test
    void batchModeCollectsEveryBatch() {
        settings.getBatch().setEnabled(true);
        settings.getBatch().setBatchSize(4);
        settings.getBatch().setBatchDelayMs(0);
        ScriptedCatalogSite site = new ScriptedCatalogSite(PAGE_SIZE, 10, 0);

        ListCollectionResult result = stage(site, events::add).collect(0, CancelToken.create());

        assertThat(result.succeededUnits()).isEqualTo(10);
        assertThat(result.records()).hasSize(10 * PAGE_SIZE);
        assertThat(site.maxInFlight()).isLessThanOrEqualTo(3);
    }

    @Test
    void collectedSitePagesCountsBoundaryPageSeparately() {
        SiteTotalsSnapshot totals = new SiteTotalsSnapshot(10, 5, Instant.now());

        assertThat(ListCollectionStage.computeRange(totals, 0, 0, mapper)).isEqualTo(new PageRange(9, 0));
        assertThat(ListCollectionStage.computeRange(totals, 0, 5, mapper)).isEqualTo(new PageRange(8, 0));
        assertThat(ListCollectionStage.computeRange(totals, 0, 6, mapper)).isEqualTo(new PageRange(7, 0));
        assertThat(ListCollectionStage.computeRange(totals, 2, 17, mapper)).isEqualTo(new PageRange(7, 6));
        assertThat(ListCollectionStage.computeRange(totals, 0, 113, mapper)).isNull();
        assertThat(ListCollectionStage.collectedSitePages(0, 5, PAGE_SIZE)).isZero();
    }

    private ListCollectionStage stage(ScriptedCatalogSite site, CrawlEventListener listener) {
        SiteTotalsCache totalsCache = new SiteTotalsCache(Duration.ofMinutes(5), 1, Duration.ZERO, clock);
        return new ListCollectionStage(site, pool, totalsCache, store, mapper, settings, clock, listener);
    }

    private StageTransitionEvent lastTransition() {
        List<StageTransitionEvent> transitions = events.stream()
            .filter(StageTransitionEvent.class::isInstance)
            .map(StageTransitionEvent.class::cast)
            .toList();
        return transitions.get(transitions.size() - 1);
    }
}
