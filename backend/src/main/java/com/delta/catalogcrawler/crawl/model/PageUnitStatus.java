package com.delta.catalogcrawler.crawl.model;

public enum PageUnitStatus {
    WAITING,
    ATTEMPTING,
    SUCCESS,
    INCOMPLETE,
    FAILED;

    public boolean isOutstanding() {
        return this == INCOMPLETE || this == FAILED;
    }

    public boolean isFinished() {
        return this == SUCCESS || this == INCOMPLETE || this == FAILED;
    }
}
