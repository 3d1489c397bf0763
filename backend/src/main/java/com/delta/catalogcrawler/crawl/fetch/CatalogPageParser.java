package com.delta.catalogcrawler.crawl.fetch;

import com.delta.catalogcrawler.config.CrawlerProperties;
import com.delta.catalogcrawler.crawl.model.ListingRecord;
import com.delta.catalogcrawler.crawl.model.RecordDetail;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class CatalogPageParser {
    private static final Pattern PAGE_NUMBER = Pattern.compile("(\\d+)");
    private static final Pattern PAGE_IN_HREF = Pattern.compile("(?:page[=/]|/page/)(\\d+)");

    private final CrawlerProperties properties;

    public CatalogPageParser(CrawlerProperties properties) {
        this.properties = properties;
    }

    public Document parse(String html, String baseUrl) {
        return Jsoup.parse(html == null ? "" : html, baseUrl == null ? "" : baseUrl);
    }

    /**
     * Records of one listing page with slots ascending from the oldest record.
     */
    public List<ListingRecord> parseListing(Document document) {
        CrawlerProperties.Catalog catalog = properties.getCatalog();
        Elements items = document.select(catalog.getRecordSelector());
        List<Element> ordered = new ArrayList<>(items);
        if (catalog.isNewestFirst()) {
            Collections.reverse(ordered);
        }
        List<ListingRecord> records = new ArrayList<>(ordered.size());
        for (Element item : ordered) {
            Element link = item.selectFirst(catalog.getLinkSelector());
            if (link == null) {
                throw new CrawlException(CrawlErrorKind.EXTRACTION, "listing record without link on " + document.location());
            }
            String url = link.absUrl("href");
            if (url.isBlank()) {
                url = link.attr("href");
            }
            Element titleElement = item.selectFirst(catalog.getTitleSelector());
            String title = titleElement == null ? link.text() : titleElement.text();
            records.add(new ListingRecord(url, title, records.size()));
        }
        return records;
    }

    public int parseMaxPageNumber(Document document) {
        int max = 0;
        for (Element link : document.select(properties.getCatalog().getPaginationSelector())) {
            max = Math.max(max, pageNumber(link));
        }
        if (max == 0 && !document.select(properties.getCatalog().getRecordSelector()).isEmpty()) {
            return 1;
        }
        return max;
    }

    public RecordDetail parseDetail(Document document, String url) {
        CrawlerProperties.Catalog catalog = properties.getCatalog();
        Element titleElement = document.selectFirst(catalog.getDetailTitleSelector());
        if (titleElement == null) {
            throw new CrawlException(CrawlErrorKind.EXTRACTION, "detail page without title: " + url);
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        for (Element row : document.select(catalog.getDetailFieldSelector())) {
            Elements cells = row.select("th, td");
            if (cells.size() < 2) {
                continue;
            }
            String key = cells.get(0).text().trim();
            String value = cells.get(1).text().trim();
            if (!key.isEmpty()) {
                attributes.putIfAbsent(key, value);
            }
        }
        return new RecordDetail(url, titleElement.text(), attributes, Instant.now());
    }

    private int pageNumber(Element link) {
        Matcher textMatch = PAGE_NUMBER.matcher(link.text().trim());
        if (link.text().trim().matches("\\d+") && textMatch.find()) {
            return parseIntSafe(textMatch.group(1));
        }
        Matcher hrefMatch = PAGE_IN_HREF.matcher(link.attr("href"));
        if (hrefMatch.find()) {
            return parseIntSafe(hrefMatch.group(1));
        }
        return 0;
    }

    private int parseIntSafe(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ignored) {
            return 0;
        }
    }
}
