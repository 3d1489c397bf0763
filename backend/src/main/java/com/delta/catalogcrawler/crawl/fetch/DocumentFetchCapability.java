package com.delta.catalogcrawler.crawl.fetch;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.concurrent.CancelToken;
import com.delta.catalogcrawler.crawl.model.ListingPage;
import com.delta.catalogcrawler.crawl.model.ListingRecord;
import com.delta.catalogcrawler.crawl.model.RecordDetail;
import com.delta.catalogcrawler.crawl.model.SiteTotals;
import org.jsoup.nodes.Document;

import java.util.List;

/**
 * Shared listing, totals and detail logic for transports that yield a parsed jsoup {@link Document}.
 */
public abstract class DocumentFetchCapability implements FetchCapability {
    protected final CrawlerProperties properties;
    protected final CatalogPageParser parser;

    protected DocumentFetchCapability(CrawlerProperties properties, CatalogPageParser parser) {
        this.properties = properties;
        this.parser = parser;
    }

    protected abstract Document fetchDocument(String url, CancelToken cancelToken);

    @Override
    public ListingPage fetchListingPage(int sitePage, CancelToken cancelToken, int attempt) {
        CancelToken token = guard(cancelToken);
        String url = properties.getCatalog().listingUrl(sitePage);
        Document document = fetchDocument(url, token);
        token.throwIfCancelled();
        List<ListingRecord> records = parseListing(document, url);
        return new ListingPage(sitePage, url, attempt, records);
    }

    @Override
    public SiteTotals fetchSiteTotals(CancelToken cancelToken) {
        CancelToken token = guard(cancelToken);
        String entryUrl = properties.getCatalog().entryUrl();
        Document entry = fetchDocument(entryUrl, token);
        int totalPages = parser.parseMaxPageNumber(entry);
        if (totalPages <= 0) {
            throw new CrawlException(CrawlErrorKind.EXTRACTION, "no pagination found on " + entryUrl);
        }
        String boundaryUrl = properties.getCatalog().listingUrl(1);
        Document boundary = boundaryUrl.equals(entryUrl) ? entry : fetchDocument(boundaryUrl, token);
        int lastPageRecordCount = parseListing(boundary, boundaryUrl).size();
        return new SiteTotals(totalPages, lastPageRecordCount);
    }

    @Override
    public RecordDetail fetchRecordDetail(String url, CancelToken cancelToken, int attempt) {
        CancelToken token = guard(cancelToken);
        Document document = fetchDocument(url, token);
        token.throwIfCancelled();
        try {
            return parser.parseDetail(document, url);
        } catch (CrawlException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CrawlException(CrawlErrorKind.EXTRACTION, "detail extraction failed for " + url + ": " + e.getMessage(), e);
        }
    }

    private List<ListingRecord> parseListing(Document document, String url) {
        try {
            return parser.parseListing(document);
        } catch (CrawlException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CrawlException(CrawlErrorKind.EXTRACTION, "listing extraction failed for " + url + ": " + e.getMessage(), e);
        }
    }

    private CancelToken guard(CancelToken cancelToken) {
        CancelToken token = cancelToken == null ? CancelToken.create() : cancelToken;
        token.throwIfCancelled();
        return token;
    }
}
