package com.delta.catalogcrawler.crawl.stage;

import com.delta.catalogcrawler.crawl.model.PageUnitStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * One unit of stage work. Mutated only through its {@link StageState}.
 */
public final class PageUnit {
    private final int id;
    private volatile PageUnitStatus status = PageUnitStatus.WAITING;
    private volatile int attempt;
    private final List<String> errors = new ArrayList<>();

    PageUnit(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public PageUnitStatus status() {
        return status;
    }

    public int attempt() {
        return attempt;
    }

    public synchronized List<String> errors() {
        return List.copyOf(errors);
    }

    synchronized int begin(boolean retryCycle) {
        boolean allowed = status == PageUnitStatus.WAITING || (retryCycle && status.isOutstanding());
        if (!allowed) {
            throw new IllegalStateException("unit " + id + " cannot start an attempt from " + status);
        }
        status = PageUnitStatus.ATTEMPTING;
        attempt++;
        return attempt;
    }

    synchronized void finish(PageUnitStatus next, String error) {
        if (status != PageUnitStatus.ATTEMPTING || next == null || !next.isFinished()) {
            throw new IllegalStateException("unit " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
        if (error != null && !error.isBlank()) {
            errors.add("Attempt " + attempt + ": " + error);
        }
    }
}
