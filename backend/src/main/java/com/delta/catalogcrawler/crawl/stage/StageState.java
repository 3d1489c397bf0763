package com.delta.catalogcrawler.crawl.stage;

import com.delta.catalogcrawler.crawl.model.FailedUnitReport;
import com.delta.catalogcrawler.crawl.model.PageUnitStatus;
import com.delta.catalogcrawler.crawl.progress.CrawlEventListener;
import com.delta.catalogcrawler.crawl.progress.StageTransitionEvent;
import com.delta.catalogcrawler.crawl.progress.UnitStatusEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Phase machine and per-unit status table of one collection stage.
 */
public class StageState {
    private static final Logger log = LoggerFactory.getLogger(StageState.class);

    private final StageKind kind;
    private final Map<Integer, PageUnit> units;
    private final int maxRetries;
    private final Clock clock;
    private final CrawlEventListener listener;
    private final Instant startedAt;

    private StagePhase phase = StagePhase.INIT;
    private int retryCycle;
    private boolean cancelled;

    public StageState(
        StageKind kind,
        Collection<Integer> unitIds,
        int maxRetries,
        Clock clock,
        CrawlEventListener listener
    ) {
        this.kind = kind;
        this.maxRetries = Math.max(0, maxRetries);
        this.clock = clock;
        this.listener = listener == null ? event -> { } : listener;
        this.startedAt = clock.instant();
        Map<Integer, PageUnit> table = new LinkedHashMap<>();
        for (Integer id : unitIds) {
            if (table.putIfAbsent(id, new PageUnit(id)) != null) {
                throw new IllegalArgumentException("duplicate unit " + id + " in " + kind + " stage");
            }
        }
        this.units = table;
    }

    public StageKind kind() {
        return kind;
    }

    public synchronized StagePhase phase() {
        return phase;
    }

    public synchronized int retryCycle() {
        return retryCycle;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    public int totalUnits() {
        return units.size();
    }

    public PageUnit unit(int id) {
        PageUnit unit = units.get(id);
        if (unit == null) {
            throw new IllegalArgumentException("unknown unit " + id + " in " + kind + " stage");
        }
        return unit;
    }

    public synchronized void setStage(StagePhase next, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("stage transition needs a reason");
        }
        if (!phase.successors().contains(next)) {
            throw new IllegalStateException(kind + " stage cannot move from " + phase + " to " + next);
        }
        if (next == StagePhase.RETRYING && !canRetry()) {
            throw new IllegalStateException(kind + " stage has nothing to retry or no retry budget left");
        }
        if (next == StagePhase.PROCESSING) {
            if (count(PageUnitStatus.ATTEMPTING) > 0) {
                throw new IllegalStateException(kind + " stage still has units in flight");
            }
            if (!cancelled && canRetry()) {
                throw new IllegalStateException(kind + " stage has outstanding units and retry budget left");
            }
        }
        StagePhase previous = phase;
        phase = next;
        if (next == StagePhase.RETRYING) {
            retryCycle++;
        }
        log.info("{} stage {} -> {}: {}", kind, previous, next, reason);
        listener.onEvent(new StageTransitionEvent(kind, previous, next, reason, units.size(), retryCycle, clock.instant()));
    }

    public synchronized void markCancelled() {
        cancelled = true;
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public synchronized boolean canRetry() {
        return retryCycle < maxRetries && !outstandingUnitIds().isEmpty();
    }

    /**
     * Moves a unit to attempting. Outstanding units may only restart inside a retry cycle.
     */
    public int beginAttempt(int id) {
        PageUnit unit = unit(id);
        PageUnitStatus previous = unit.status();
        boolean inRetryCycle;
        synchronized (this) {
            if (phase != StagePhase.COLLECTING) {
                throw new IllegalStateException(kind + " stage is " + phase + ", not collecting");
            }
            inRetryCycle = retryCycle > 0;
        }
        int attempt = unit.begin(inRetryCycle);
        listener.onEvent(new UnitStatusEvent(kind, id, previous, PageUnitStatus.ATTEMPTING, attempt, null, clock.instant()));
        return attempt;
    }

    public void finishAttempt(int id, PageUnitStatus status, String error) {
        PageUnit unit = unit(id);
        unit.finish(status, error);
        if (status != PageUnitStatus.SUCCESS) {
            log.warn("{} {} {} ended {} on attempt {}: {}", kind, kind.unitName(), id, status, unit.attempt(), error);
        }
        listener.onEvent(new UnitStatusEvent(kind, id, PageUnitStatus.ATTEMPTING, status, unit.attempt(), error, clock.instant()));
    }

    public List<Integer> outstandingUnitIds() {
        List<Integer> ids = new ArrayList<>();
        for (PageUnit unit : units.values()) {
            if (unit.status().isOutstanding()) {
                ids.add(unit.id());
            }
        }
        return ids;
    }

    public List<Integer> unitIds() {
        return List.copyOf(units.keySet());
    }

    public int count(PageUnitStatus status) {
        int total = 0;
        for (PageUnit unit : units.values()) {
            if (unit.status() == status) {
                total++;
            }
        }
        return total;
    }

    public Map<PageUnitStatus, Integer> counts() {
        Map<PageUnitStatus, Integer> counts = new EnumMap<>(PageUnitStatus.class);
        for (PageUnitStatus status : PageUnitStatus.values()) {
            counts.put(status, 0);
        }
        for (PageUnit unit : units.values()) {
            counts.merge(unit.status(), 1, Integer::sum);
        }
        return counts;
    }

    public int attemptedUnits() {
        return units.size() - count(PageUnitStatus.WAITING);
    }

    public double successRate() {
        int attempted = attemptedUnits();
        return attempted == 0 ? 0.0 : (double) count(PageUnitStatus.SUCCESS) / attempted;
    }

    public List<FailedUnitReport> failureReports(IntFunction<Integer> sitePageOf, IntFunction<String> urlOf) {
        List<FailedUnitReport> reports = new ArrayList<>();
        for (PageUnit unit : units.values()) {
            if (!unit.status().isOutstanding()) {
                continue;
            }
            reports.add(new FailedUnitReport(
                unit.id(),
                sitePageOf == null ? null : sitePageOf.apply(unit.id()),
                urlOf == null ? null : urlOf.apply(unit.id()),
                unit.status(),
                unit.attempt(),
                unit.errors()
            ));
        }
        return reports;
    }
}
