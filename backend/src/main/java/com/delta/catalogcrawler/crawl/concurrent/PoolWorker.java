package com.delta.catalogcrawler.crawl.concurrent;

@FunctionalInterface
public interface PoolWorker<T, R> {
    R apply(T item, CancelToken cancelToken) throws Exception;
}
