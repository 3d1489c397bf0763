package com.delta.catalogcrawler.crawl.fetch;

import com.delta.catalogcrawler.crawl.concurrent.CancelToken;
import com.delta.catalogcrawler.crawl.model.ListingPage;
import com.delta.catalogcrawler.crawl.model.RecordDetail;
import com.delta.catalogcrawler.crawl.model.SiteTotals;

/**
 * Transport used by the collection stages. Implementations report every failure as a {@link CrawlException}.
 */
public interface FetchCapability {
    String name();

    ListingPage fetchListingPage(int sitePage, CancelToken cancelToken, int attempt);

    SiteTotals fetchSiteTotals(CancelToken cancelToken);

    RecordDetail fetchRecordDetail(String url, CancelToken cancelToken, int attempt);
}
