package com.delta.catalogcrawler.crawl.fetch;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.concurrent.CancelToken;
import com.delta.catalogcrawler.crawl.http.PoliteHttpClient;
import com.delta.catalogcrawler.crawl.model.HttpFetchResult;
import com.delta.catalogcrawler.crawl.util.FetchErrorClassifier;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

@Component
public class HttpFetchCapability extends DocumentFetchCapability {
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml";

    private final PoliteHttpClient httpClient;

    public HttpFetchCapability(CrawlerProperties properties, CatalogPageParser parser, PoliteHttpClient httpClient) {
        super(properties, parser);
        this.httpClient = httpClient;
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    protected Document fetchDocument(String url, CancelToken cancelToken) {
        HttpFetchResult result = httpClient.get(url, ACCEPT_HTML, cancelToken);
        if (cancelToken.isCancelled()) {
            throw CrawlException.aborted(cancelToken.reason());
        }
        if (!result.isSuccessful()) {
            CrawlErrorKind kind = FetchErrorClassifier.fromHttpResult(result);
            String detail = result.errorCode() != null
                ? result.errorCode() + " " + result.errorMessage()
                : "http_" + result.statusCode();
            throw new CrawlException(kind, "GET " + url + " failed after " + result.attempts() + " attempt(s): " + detail);
        }
        if (result.body() == null || result.body().isBlank()) {
            throw new CrawlException(CrawlErrorKind.EXTRACTION, "empty body from " + url);
        }
        return parser.parse(result.body(), result.finalUrlOrRequested());
    }
}
