package com.delta.catalogcrawler.crawl.concurrent;

import com.delta.catalogcrawler.crawl.fetch.CrawlErrorKind;
import com.delta.catalogcrawler.crawl.fetch.CrawlException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class ConcurrencyPoolTest {
    private final ExecutorService executor = Executors.newFixedThreadPool(8);
    private final ConcurrencyPool pool = new ConcurrencyPool(executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void neverRunsMoreThanConcurrencyItemsAtOnceAndKeepsInputOrder() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        List<Integer> items = IntStream.range(0, 20).boxed().toList();

        List<PoolResult<Integer>> results = pool.run(items, (item, token) -> {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            Thread.sleep(5);
            inFlight.decrementAndGet();
            return item * 2;
        }, 3, CancelToken.create());

        assertThat(maxInFlight.get()).isLessThanOrEqualTo(3);
        assertThat(results).hasSize(20);
        for (int i = 0; i < results.size(); i++) {
            assertThat(results.get(i).index()).isEqualTo(i);
            assertThat(results.get(i).isCompleted()).isTrue();
            assertThat(results.get(i).value()).isEqualTo(i * 2);
        }
    }

    @Test
    void failingItemDoesNotStopTheOthers() {
        List<PoolResult<String>> results = pool.run(List.of("a", "b", "c"), (item, token) -> {
            if (item.equals("b")) {
                throw new CrawlException(CrawlErrorKind.NAVIGATION, "b is down");
            }
            return item.toUpperCase();
        }, 2, CancelToken.create());

        assertThat(results.get(0).value()).isEqualTo("A");
        assertThat(results.get(1).outcome()).isEqualTo(PoolResult.Outcome.FAILED);
        assertThat(results.get(1).error()).hasMessage("b is down");
        assertThat(results.get(2).value()).isEqualTo("C");
    }

    @Test
    void cancellationLeavesRemainingItemsNotStarted() {
        CancelToken token = CancelToken.create();
        List<Integer> items = IntStream.range(0, 6).boxed().toList();

        List<PoolResult<Integer>> results = pool.run(items, (item, workerToken) -> {
            if (item == 2) {
                workerToken.cancel("test_stop");
            }
            return item;
        }, 1, token);

        assertThat(token.reason()).isEqualTo("test_stop");
        assertThat(results.subList(0, 3)).allMatch(PoolResult::isCompleted);
        assertThat(results.subList(3, 6))
            .extracting(PoolResult::outcome)
            .containsOnly(PoolResult.Outcome.NOT_STARTED);
    }

    @Test
    void inFlightItemInterruptedByCancellationIsAborted() {
        CancelToken token = CancelToken.create();
        CountDownLatch slowItemStarted = new CountDownLatch(1);
        List<Integer> items = IntStream.range(0, 4).boxed().toList();

        List<PoolResult<Integer>> results = pool.run(items, (item, workerToken) -> {
            if (item == 0) {
                slowItemStarted.countDown();
                if (!workerToken.sleep(Duration.ofSeconds(10))) {
                    throw CrawlException.aborted(workerToken.reason());
                }
                return item;
            }
            assertThat(slowItemStarted.await(5, TimeUnit.SECONDS)).isTrue();
            workerToken.cancel("test_stop");
            return item;
        }, 2, token);

        assertThat(results).extracting(PoolResult::outcome).containsExactly(
            PoolResult.Outcome.ABORTED,
            PoolResult.Outcome.COMPLETED,
            PoolResult.Outcome.NOT_STARTED,
            PoolResult.Outcome.NOT_STARTED
        );
        assertThat(results.get(0).error()).isInstanceOf(CrawlException.class);
    }

    @Test
    void emptyInputReturnsNoResults() {
        assertThat(pool.run(List.<Integer>of(), (item, token) -> item, 4, CancelToken.create())).isEmpty();
    }
}
