package com.delta.catalogcrawler.crawl.concurrent;

public record PoolResult<R>(
    int index,
    Outcome outcome,
    R value,
    Throwable error
) {
    public enum Outcome {
        COMPLETED,
        FAILED,
        ABORTED,
        NOT_STARTED
    }

    public static <R> PoolResult<R> completed(int index, R value) {
        return new PoolResult<>(index, Outcome.COMPLETED, value, null);
    }

    public static <R> PoolResult<R> failed(int index, Throwable error) {
        return new PoolResult<>(index, Outcome.FAILED, null, error);
    }

    public static <R> PoolResult<R> aborted(int index, Throwable error) {
        return new PoolResult<>(index, Outcome.ABORTED, null, error);
    }

    public static <R> PoolResult<R> notStarted(int index) {
        return new PoolResult<>(index, Outcome.NOT_STARTED, null, null);
    }

    public boolean isCompleted() {
        return outcome == Outcome.COMPLETED;
    }
}
