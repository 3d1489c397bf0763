package com.delta.catalogcrawler.crawl.concurrent;

import com.delta.catalogcrawler.crawl.fetch.CrawlErrorKind;
import com.delta.catalogcrawler.crawl.util.FetchErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs items through at most {@code concurrency} worker loops on the crawl executor.
 *
 * <p>Results come back in input order. A failing item is recorded and its loop moves on; only the cancel token
 * stops the remaining items, which are then reported as {@link PoolResult.Outcome#NOT_STARTED}.
 */
@Component
public class ConcurrencyPool {
    private static final Logger log = LoggerFactory.getLogger(ConcurrencyPool.class);

    private final ExecutorService crawlExecutor;

    public ConcurrencyPool(@Qualifier("crawlExecutor") ExecutorService crawlExecutor) {
        this.crawlExecutor = crawlExecutor;
    }

    public <T, R> List<PoolResult<R>> run(
        List<T> items,
        PoolWorker<T, R> worker,
        int concurrency,
        CancelToken cancelToken
    ) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        CancelToken token = cancelToken == null ? CancelToken.create() : cancelToken;
        int size = items.size();
        AtomicInteger nextIndex = new AtomicInteger();
        AtomicReferenceArray<PoolResult<R>> results = new AtomicReferenceArray<>(size);
        int loops = Math.min(Math.max(1, concurrency), size);

        List<CompletableFuture<Void>> futures = new ArrayList<>(loops);
        for (int i = 0; i < loops; i++) {
            futures.add(CompletableFuture.runAsync(
                () -> workLoop(items, worker, token, nextIndex, results),
                crawlExecutor
            ));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            throw new IllegalStateException("Concurrency pool worker loop crashed", e.getCause());
        }

        List<PoolResult<R>> ordered = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            PoolResult<R> result = results.get(i);
            ordered.add(result == null ? PoolResult.notStarted(i) : result);
        }
        return ordered;
    }

    private <T, R> void workLoop(
        List<T> items,
        PoolWorker<T, R> worker,
        CancelToken token,
        AtomicInteger nextIndex,
        AtomicReferenceArray<PoolResult<R>> results
    ) {
        while (!token.isCancelled()) {
            int index = nextIndex.getAndIncrement();
            if (index >= items.size()) {
                return;
            }
            T item = items.get(index);
            try {
                results.set(index, PoolResult.completed(index, worker.apply(item, token)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.set(index, PoolResult.aborted(index, e));
                return;
            } catch (Exception e) {
                if (token.isCancelled() || FetchErrorClassifier.fromThrowable(e) == CrawlErrorKind.ABORTED) {
                    results.set(index, PoolResult.aborted(index, e));
                } else {
                    log.debug("Pool item {} failed: {}", index, e.getMessage());
                    results.set(index, PoolResult.failed(index, e));
                }
            }
        }
    }
}
