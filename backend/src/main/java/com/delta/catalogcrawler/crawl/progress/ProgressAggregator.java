package com.delta.catalogcrawler.crawl.progress;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.PageUnitStatus;
import com.delta.catalogcrawler.crawl.stage.StageKind;
import com.delta.catalogcrawler.crawl.stage.StagePhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Folds stage events into sequence-numbered progress snapshots.
 *
 * <p>Boundary events are forwarded as they arrive and always produce a snapshot. Unit status events only
 * produce one when the throttle interval has passed since the previous snapshot.
 */
@Component
public class ProgressAggregator {
    private static final Logger log = LoggerFactory.getLogger(ProgressAggregator.class);

    private final List<CrawlEventListener> listeners;
    private final Clock clock;
    private final Duration throttle;

    private final Map<PageUnitStatus, Integer> counts = new EnumMap<>(PageUnitStatus.class);
    private long sequence;
    private Instant lastEmittedAt;
    private StageKind stage;
    private StagePhase phase;
    private int totalUnits;
    private int retryCycle;
    private Instant stageStartedAt;
    private volatile ProgressSnapshot latest;

    public ProgressAggregator(List<CrawlEventListener> listeners, CrawlerProperties properties, Clock clock) {
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.clock = clock;
        this.throttle = Duration.ofMillis(properties.getProgress().getThrottleMs());
        resetCounts(0);
    }

    public synchronized void publish(CrawlEvent event) {
        if (event == null) {
            return;
        }
        if (event instanceof StageTransitionEvent transition) {
            applyTransition(transition);
        } else if (event instanceof UnitStatusEvent unitStatus) {
            applyUnitStatus(unitStatus);
        }
        if (event.boundary()) {
            forward(event);
        }
        if (stage == null) {
            return;
        }
        Instant now = clock.instant();
        boolean due = lastEmittedAt == null || !now.isBefore(lastEmittedAt.plus(throttle));
        if (event.boundary() || due) {
            emitSnapshot(now, messageFor(event));
        }
    }

    public ProgressSnapshot latest() {
        return latest;
    }

    public synchronized long sequence() {
        return sequence;
    }

    private void applyTransition(StageTransitionEvent transition) {
        if (transition.stage() != stage || transition.from() == StagePhase.INIT) {
            stage = transition.stage();
            stageStartedAt = transition.at();
            resetCounts(transition.totalUnits());
        }
        phase = transition.to();
        totalUnits = transition.totalUnits();
        retryCycle = transition.retryCycle();
    }

    private void applyUnitStatus(UnitStatusEvent unitStatus) {
        if (unitStatus.stage() != stage) {
            return;
        }
        if (unitStatus.previous() != null) {
            counts.merge(unitStatus.previous(), -1, Integer::sum);
        }
        counts.merge(unitStatus.status(), 1, Integer::sum);
    }

    private void resetCounts(int total) {
        for (PageUnitStatus status : PageUnitStatus.values()) {
            counts.put(status, 0);
        }
        counts.put(PageUnitStatus.WAITING, total);
    }

    private void emitSnapshot(Instant now, String message) {
        int waiting = counts.get(PageUnitStatus.WAITING);
        int attempting = counts.get(PageUnitStatus.ATTEMPTING);
        int done = Math.max(0, totalUnits - waiting - attempting);
        Duration elapsed = stageStartedAt == null ? Duration.ZERO : Duration.between(stageStartedAt, now);
        Duration remaining = done == 0
            ? null
            : elapsed.multipliedBy(Math.max(0, totalUnits - done)).dividedBy(done);
        double percentage = totalUnits == 0 ? 100.0 : done * 100.0 / totalUnits;
        sequence++;
        lastEmittedAt = now;
        ProgressSnapshot snapshot = new ProgressSnapshot(
            sequence,
            stage,
            phase,
            totalUnits,
            waiting,
            attempting,
            counts.get(PageUnitStatus.SUCCESS),
            counts.get(PageUnitStatus.INCOMPLETE),
            counts.get(PageUnitStatus.FAILED),
            retryCycle,
            percentage,
            elapsed,
            remaining,
            message,
            now
        );
        latest = snapshot;
        forward(snapshot);
    }

    private String messageFor(CrawlEvent event) {
        if (event instanceof StageTransitionEvent transition) {
            return transition.reason();
        }
        if (event instanceof UnitStatusEvent unitStatus) {
            return unitStatus.stage().unitName() + " " + unitStatus.unitId() + " " + unitStatus.status();
        }
        return event.getClass().getSimpleName();
    }

    private void forward(CrawlEvent event) {
        for (CrawlEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Crawl event listener {} failed on {}", listener.getClass().getSimpleName(), event.getClass().getSimpleName(), e);
            }
        }
    }
}
