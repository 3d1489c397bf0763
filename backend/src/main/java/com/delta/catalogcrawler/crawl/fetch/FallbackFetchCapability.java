package com.delta.catalogcrawler.crawl.fetch;

import com.delta.catalogcrawler.crawl.concurrent.CancelToken;
import com.delta.catalogcrawler.crawl.model.ListingPage;
import com.delta.catalogcrawler.crawl.model.RecordDetail;
import com.delta.catalogcrawler.crawl.model.SiteTotals;
import com.delta.catalogcrawler.crawl.util.FetchErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Tries the primary transport and repeats the call on the secondary one after a transport-level failure.
 */
public class FallbackFetchCapability implements FetchCapability {
    private static final Logger log = LoggerFactory.getLogger(FallbackFetchCapability.class);

    private final FetchCapability primary;
    private final FetchCapability secondary;

    public FallbackFetchCapability(FetchCapability primary, FetchCapability secondary) {
        this.primary = primary;
        this.secondary = secondary;
    }

    @Override
    public String name() {
        return primary.name() + "+" + secondary.name();
    }

    @Override
    public ListingPage fetchListingPage(int sitePage, CancelToken cancelToken, int attempt) {
        return withFallback("listing page " + sitePage, cancelToken, capability -> capability.fetchListingPage(sitePage, cancelToken, attempt));
    }

    @Override
    public SiteTotals fetchSiteTotals(CancelToken cancelToken) {
        return withFallback("site totals", cancelToken, capability -> capability.fetchSiteTotals(cancelToken));
    }

    @Override
    public RecordDetail fetchRecordDetail(String url, CancelToken cancelToken, int attempt) {
        return withFallback("detail " + url, cancelToken, capability -> capability.fetchRecordDetail(url, cancelToken, attempt));
    }

    private <T> T withFallback(String what, CancelToken cancelToken, Function<FetchCapability, T> call) {
        try {
            return call.apply(primary);
        } catch (CrawlException e) {
            boolean cancelled = cancelToken != null && cancelToken.isCancelled();
            if (cancelled || !FetchErrorClassifier.allowsFallback(e.kind())) {
                throw e;
            }
            log.warn("{} via {} failed ({}), falling back to {}", what, primary.name(), e.kind(), secondary.name());
            return call.apply(secondary);
        }
    }
}
