package com.delta.catalogcrawler.crawl.stage;

import java.util.EnumSet;
import java.util.Set;

public enum StagePhase {
    INIT,
    COLLECTING,
    RETRYING,
    PROCESSING,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    public Set<StagePhase> successors() {
        return switch (this) {
            case INIT -> EnumSet.of(COLLECTING, FAILED);
            case COLLECTING -> EnumSet.of(RETRYING, PROCESSING, FAILED);
            case RETRYING -> EnumSet.of(COLLECTING, PROCESSING, FAILED);
            case PROCESSING -> EnumSet.of(COMPLETE, FAILED);
            case COMPLETE, FAILED -> EnumSet.noneOf(StagePhase.class);
        };
    }
}
