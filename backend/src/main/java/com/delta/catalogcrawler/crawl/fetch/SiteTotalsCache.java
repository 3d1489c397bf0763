package com.delta.catalogcrawler.crawl.fetch;

import com.delta.catalogcrawler.crawl.concurrent.CancelToken;
import com.delta.catalogcrawler.crawl.model.SiteTotals;
import com.delta.catalogcrawler.crawl.model.SiteTotalsSnapshot;
import com.delta.catalogcrawler.crawl.util.FetchErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Site totals snapshot shared by everything one engine runs. A snapshot older than the TTL is refetched;
 * concurrent refreshes may race and the last one written wins.
 */
public class SiteTotalsCache {
    private static final Logger log = LoggerFactory.getLogger(SiteTotalsCache.class);

    private final Duration ttl;
    private final int maxAttempts;
    private final Duration retryDelay;
    private final Clock clock;
    private final AtomicReference<SiteTotalsSnapshot> current = new AtomicReference<>();

    public SiteTotalsCache(Duration ttl, int maxAttempts, Duration retryDelay, Clock clock) {
        this.ttl = ttl;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryDelay = retryDelay;
        this.clock = clock;
    }

    public SiteTotalsSnapshot get(FetchCapability capability, CancelToken cancelToken) {
        SiteTotalsSnapshot snapshot = current.get();
        if (snapshot != null && isFresh(snapshot)) {
            return snapshot;
        }
        return refresh(capability, cancelToken);
    }

    public SiteTotalsSnapshot refresh(FetchCapability capability, CancelToken cancelToken) {
        CancelToken token = cancelToken == null ? CancelToken.create() : cancelToken;
        CrawlException lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            token.throwIfCancelled();
            try {
                SiteTotals totals = capability.fetchSiteTotals(token);
                SiteTotalsSnapshot snapshot = SiteTotalsSnapshot.of(totals, clock.instant());
                current.set(snapshot);
                log.info(
                    "Site totals via {}: totalPages={} lastPageRecordCount={}",
                    capability.name(),
                    snapshot.totalPages(),
                    snapshot.lastPageRecordCount()
                );
                return snapshot;
            } catch (IllegalArgumentException e) {
                lastError = new CrawlException(CrawlErrorKind.EXTRACTION, "invalid site totals: " + e.getMessage(), e);
            } catch (RuntimeException e) {
                CrawlException crawlException = FetchErrorClassifier.toCrawlException(e, "site totals");
                if (crawlException.isAborted()) {
                    throw crawlException;
                }
                lastError = crawlException;
            }
            log.warn("Site totals attempt {}/{} failed: {}", attempt, maxAttempts, lastError.getMessage());
            if (attempt < maxAttempts && !token.sleep(retryDelay)) {
                throw CrawlException.aborted(token.reason());
            }
        }
        throw new CrawlException(
            CrawlErrorKind.INITIALIZATION,
            "site totals unavailable after " + maxAttempts + " attempts: " + lastError.getMessage(),
            lastError
        );
    }

    public SiteTotalsSnapshot peek() {
        return current.get();
    }

    public void invalidate() {
        current.set(null);
    }

    private boolean isFresh(SiteTotalsSnapshot snapshot) {
        return !snapshot.fetchedAt().plus(ttl).isBefore(clock.instant());
    }
}
