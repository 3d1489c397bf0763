package com.delta.catalogcrawler.crawl.stage;

import com.delta.catalogcrawler.crawl.model.FailedUnitReport;
import com.delta.catalogcrawler.crawl.model.PageUnitStatus;
import com.delta.catalogcrawler.crawl.progress.CrawlEvent;
import com.delta.catalogcrawler.crawl.progress.StageTransitionEvent;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageStateTest {
    private final Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    private final List<CrawlEvent> events = new ArrayList<>();

    @Test
    void retryCycleRestartsOnlyOutstandingUnitsAndKeepsAttemptLog() {
        StageState state = new StageState(StageKind.LIST, List.of(3, 2, 1), 2, clock, events::add);
        state.setStage(StagePhase.COLLECTING, "start");

        finish(state, 3, PageUnitStatus.SUCCESS, null);
        finish(state, 2, PageUnitStatus.FAILED, "timeout");
        finish(state, 1, PageUnitStatus.INCOMPLETE, "collected 3 of 12");

        assertThat(state.outstandingUnitIds()).containsExactly(2, 1);
        assertThat(state.canRetry()).isTrue();
        assertThatThrownBy(() -> state.setStage(StagePhase.PROCESSING, "too early"))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> state.beginAttempt(2)).isInstanceOf(IllegalStateException.class);

        state.setStage(StagePhase.RETRYING, "retry");
        assertThat(state.retryCycle()).isEqualTo(1);
        state.setStage(StagePhase.COLLECTING, "retry pass");
        assertThatThrownBy(() -> state.beginAttempt(3)).isInstanceOf(IllegalStateException.class);
        assertThat(state.beginAttempt(2)).isEqualTo(2);
        state.finishAttempt(2, PageUnitStatus.SUCCESS, null);

        assertThat(state.unit(2).errors()).containsExactly("Attempt 1: timeout");
        assertThat(state.outstandingUnitIds()).containsExactly(1);
    }

    @Test
    void exhaustedRetryBudgetAllowsProcessingAndReportsFailures() {
        StageState state = new StageState(StageKind.LIST, List.of(5, 4), 1, clock, events::add);
        state.setStage(StagePhase.COLLECTING, "start");
        finish(state, 5, PageUnitStatus.SUCCESS, null);
        finish(state, 4, PageUnitStatus.FAILED, "down");
        state.setStage(StagePhase.RETRYING, "retry");
        state.setStage(StagePhase.COLLECTING, "retry pass");
        finish(state, 4, PageUnitStatus.FAILED, "still down");

        assertThat(state.canRetry()).isFalse();
        assertThatThrownBy(() -> state.setStage(StagePhase.RETRYING, "again"))
            .isInstanceOf(IllegalStateException.class);
        state.setStage(StagePhase.PROCESSING, "budget exhausted");
        state.setStage(StagePhase.FAILED, "unresolved");

        List<FailedUnitReport> reports = state.failureReports(pageId -> 10 - pageId, null);
        assertThat(reports).hasSize(1);
        FailedUnitReport report = reports.get(0);
        assertThat(report.unitId()).isEqualTo(4);
        assertThat(report.sitePage()).isEqualTo(6);
        assertThat(report.attempts()).isEqualTo(2);
        assertThat(report.errors()).containsExactly("Attempt 1: down", "Attempt 2: still down");
        assertThat(state.successRate()).isEqualTo(0.5);
    }

    @Test
    void cancelledStageMayProcessWithOutstandingUnits() {
        StageState state = new StageState(StageKind.DETAIL, List.of(0, 1), 3, clock, events::add);
        state.setStage(StagePhase.COLLECTING, "start");
        finish(state, 0, PageUnitStatus.FAILED, "aborted");
        state.markCancelled();

        state.setStage(StagePhase.PROCESSING, "cancelled");
        state.setStage(StagePhase.FAILED, "cancelled");

        assertThat(state.phase()).isEqualTo(StagePhase.FAILED);
        assertThat(state.attemptedUnits()).isEqualTo(1);
    }

    @Test
    void terminalPhasesAcceptNoTransitionAndEveryTransitionIsPublished() {
        StageState state = new StageState(StageKind.LIST, List.of(0), 0, clock, events::add);
        state.setStage(StagePhase.COLLECTING, "start");
        finish(state, 0, PageUnitStatus.SUCCESS, null);
        state.setStage(StagePhase.PROCESSING, "done");
        state.setStage(StagePhase.COMPLETE, "done");

        assertThatThrownBy(() -> state.setStage(StagePhase.COLLECTING, "restart"))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new StageState(StageKind.LIST, List.of(1, 1), 0, clock, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(events)
            .filteredOn(StageTransitionEvent.class::isInstance)
            .extracting(event -> ((StageTransitionEvent) event).to())
            .containsExactly(StagePhase.COLLECTING, StagePhase.PROCESSING, StagePhase.COMPLETE);
    }

    private static void finish(StageState state, int id, PageUnitStatus status, String error) {
        state.beginAttempt(id);
        state.finishAttempt(id, status, error);
    }
}
