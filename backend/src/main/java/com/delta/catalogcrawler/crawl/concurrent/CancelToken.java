package com.delta.catalogcrawler.crawl.concurrent;

import com.delta.catalogcrawler.crawl.fetch.CrawlException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal shared by every unit of one top-level run.
 */
public final class CancelToken {
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public static CancelToken create() {
        return new CancelToken();
    }

    public boolean cancel(String cancelReason) {
        String safeReason = cancelReason == null || cancelReason.isBlank() ? "cancelled" : cancelReason;
        if (!reason.compareAndSet(null, safeReason)) {
            return false;
        }
        cancelled.countDown();
        for (Runnable callback : callbacks) {
            callback.run();
        }
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw CrawlException.aborted(reason.get());
        }
    }

    /**
     * Registers a callback fired once on cancellation, immediately if already cancelled.
     * Closing the returned registration removes the callback.
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Waits for {@code duration} unless cancelled first.
     *
     * @return {@code true} when the full pause elapsed
     */
    public boolean sleep(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return !isCancelled();
        }
        try {
            return !cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel("interrupted");
            return false;
        }
    }

    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
