package com.delta.catalogcrawler.crawl.fetch;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.concurrent.CancelToken;
import com.delta.catalogcrawler.crawl.util.FetchErrorClassifier;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class JsoupFetchCapability extends DocumentFetchCapability {

    public JsoupFetchCapability(CrawlerProperties properties, CatalogPageParser parser) {
        super(properties, parser);
    }

    @Override
    public String name() {
        return "jsoup";
    }

    @Override
    protected Document fetchDocument(String url, CancelToken cancelToken) {
        try {
            return Jsoup.connect(url)
                .userAgent(properties.getUserAgent())
                .timeout(properties.getFetch().getJsoupTimeoutMs())
                .get();
        } catch (HttpStatusException e) {
            throw new CrawlException(
                FetchErrorClassifier.fromHttpStatus(e.getStatusCode()),
                "GET " + url + " returned http_" + e.getStatusCode(),
                e
            );
        } catch (IOException e) {
            throw FetchErrorClassifier.toCrawlException(e, "GET " + url);
        }
    }
}
