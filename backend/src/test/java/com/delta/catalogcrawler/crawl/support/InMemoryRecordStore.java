package com.delta.catalogcrawler.crawl.support;

import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.RecordDetail;
import com.delta.catalogcrawler.crawl.model.SaveResult;
import com.delta.catalogcrawler.crawl.persistence.RecordStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRecordStore implements RecordStore {
    private final Map<String, CatalogRecord> records = new ConcurrentHashMap<>();
    private final Map<String, RecordDetail> details = new ConcurrentHashMap<>();

    public void put(int pageId, int indexInPage) {
        String url = "https://catalog.test/stored/" + pageId + "-" + indexInPage;
        records.put(url, new CatalogRecord(url, "stored " + pageId + "-" + indexInPage, 0, pageId, indexInPage));
    }

    public void fillPage(int pageId, int count) {
        for (int index = 0; index < count; index++) {
            put(pageId, index);
        }
    }

    public List<CatalogRecord> all() {
        return new ArrayList<>(records.values());
    }

    public Map<String, RecordDetail> details() {
        return details;
    }

    @Override
    public int countExisting(int pageId) {
        return (int) records.values().stream().filter(record -> record.pageId() == pageId).count();
    }

    @Override
    public Set<Integer> existingSlotIndices(int pageId) {
        Set<Integer> indices = new TreeSet<>();
        for (CatalogRecord record : records.values()) {
            if (record.pageId() == pageId) {
                indices.add(record.indexInPage());
            }
        }
        return indices;
    }

    @Override
    public OptionalInt maxKnownPageId() {
        return records.values().stream().mapToInt(CatalogRecord::pageId).max();
    }

    @Override
    public long totalRecordCount() {
        return records.size();
    }

    @Override
    public synchronized SaveResult save(List<CatalogRecord> batch) {
        SaveResult result = SaveResult.empty();
        for (CatalogRecord record : batch) {
            CatalogRecord previous = records.put(record.url(), record);
            if (previous == null) {
                result = result.plus(new SaveResult(1, 0, 0, 0));
            } else if (previous.pageId() == record.pageId()
                && previous.indexInPage() == record.indexInPage()
                && Objects.equals(previous.title(), record.title())) {
                result = result.plus(new SaveResult(0, 0, 1, 0));
            } else {
                result = result.plus(new SaveResult(0, 1, 0, 0));
            }
        }
        return result;
    }

    @Override
    public synchronized SaveResult saveDetails(List<RecordDetail> batch) {
        int updated = 0;
        int failed = 0;
        for (RecordDetail detail : batch) {
            if (records.containsKey(detail.url())) {
                details.put(detail.url(), detail);
                updated++;
            } else {
                failed++;
            }
        }
        return new SaveResult(0, updated, 0, failed);
    }
}
