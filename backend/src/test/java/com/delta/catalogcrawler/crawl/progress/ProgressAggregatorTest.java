package com.delta.catalogcrawler.crawl.progress;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.PageUnitStatus;
import com.delta.catalogcrawler.crawl.stage.StageKind;
import com.delta.catalogcrawler.crawl.stage.StagePhase;
import com.delta.catalogcrawler.crawl.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressAggregatorTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final List<CrawlEvent> forwarded = new ArrayList<>();
    private ProgressAggregator aggregator;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getProgress().setThrottleMs(1000);
        aggregator = new ProgressAggregator(List.of(forwarded::add), properties, clock);
    }

    @Test
    void unitEventsAreThrottledButBoundaryEventsAlwaysSnapshot() {
        aggregator.publish(transition(StagePhase.INIT, StagePhase.COLLECTING, 0));
        assertThat(aggregator.sequence()).isEqualTo(1);

        aggregator.publish(unit(1, PageUnitStatus.WAITING, PageUnitStatus.ATTEMPTING));
        aggregator.publish(unit(2, PageUnitStatus.WAITING, PageUnitStatus.ATTEMPTING));
        assertThat(aggregator.sequence()).isEqualTo(1);

        clock.advance(Duration.ofMillis(1000));
        aggregator.publish(unit(1, PageUnitStatus.ATTEMPTING, PageUnitStatus.SUCCESS));
        assertThat(aggregator.sequence()).isEqualTo(2);

        ProgressSnapshot snapshot = aggregator.latest();
        assertThat(snapshot.stage()).isEqualTo(StageKind.LIST);
        assertThat(snapshot.phase()).isEqualTo(StagePhase.COLLECTING);
        assertThat(snapshot.waitingUnits()).isEqualTo(2);
        assertThat(snapshot.attemptingUnits()).isEqualTo(1);
        assertThat(snapshot.succeededUnits()).isEqualTo(1);
        assertThat(snapshot.percentage()).isEqualTo(25.0);
        assertThat(snapshot.elapsed()).isEqualTo(Duration.ofSeconds(1));
        assertThat(snapshot.estimatedRemaining()).isEqualTo(Duration.ofSeconds(3));

        aggregator.publish(unit(2, PageUnitStatus.ATTEMPTING, PageUnitStatus.FAILED));
        assertThat(aggregator.sequence()).isEqualTo(2);
        aggregator.publish(transition(StagePhase.COLLECTING, StagePhase.RETRYING, 1));
        assertThat(aggregator.sequence()).isEqualTo(3);
        assertThat(aggregator.latest().failedUnits()).isEqualTo(1);
        assertThat(aggregator.latest().retryCycle()).isEqualTo(1);
    }

    @Test
    void onlyBoundaryEventsAndSnapshotsReachListeners() {
        aggregator.publish(transition(StagePhase.INIT, StagePhase.COLLECTING, 0));
        aggregator.publish(unit(1, PageUnitStatus.WAITING, PageUnitStatus.ATTEMPTING));

        assertThat(forwarded).noneMatch(UnitStatusEvent.class::isInstance);
        assertThat(forwarded).filteredOn(StageTransitionEvent.class::isInstance).hasSize(1);
        assertThat(forwarded).filteredOn(ProgressSnapshot.class::isInstance).hasSize(1);
    }

    @Test
    void sequenceNumbersIncreaseAcrossStages() {
        aggregator.publish(transition(StagePhase.INIT, StagePhase.COLLECTING, 0));
        aggregator.publish(new StageTransitionEvent(StageKind.DETAIL, StagePhase.INIT, StagePhase.COLLECTING, "details", 2, 0, clock.instant()));

        List<Long> sequences = forwarded.stream()
            .filter(ProgressSnapshot.class::isInstance)
            .map(event -> ((ProgressSnapshot) event).sequence())
            .toList();
        assertThat(sequences).containsExactly(1L, 2L);
        assertThat(aggregator.latest().stage()).isEqualTo(StageKind.DETAIL);
        assertThat(aggregator.latest().waitingUnits()).isEqualTo(2);
    }

    private StageTransitionEvent transition(StagePhase from, StagePhase to, int retryCycle) {
        return new StageTransitionEvent(StageKind.LIST, from, to, from + " to " + to, 4, retryCycle, clock.instant());
    }

    private UnitStatusEvent unit(int id, PageUnitStatus previous, PageUnitStatus status) {
        return new UnitStatusEvent(StageKind.LIST, id, previous, status, 1, null, clock.instant());
    }
}
