package com.delta.catalogcrawler.crawl.stage;

import com.delta.catalogcrawler.crawl.model.ListingRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records gathered for one page across attempts, keyed by URL.
 *
 * <p>Each fetch overwrites what earlier fetches said about the same URL. Slots are then reassigned newest fetch
 * first: a record from an older fetch keeps its slot only while no newer record claims it, otherwise it is held
 * back until a later fetch places it again. Only placed records count toward completion.
 */
final class PageAccumulator {
    private final Map<String, Seen> byUrl = new LinkedHashMap<>();
    private final Map<Integer, ListingRecord> placed = new HashMap<>();
    private int fetches;

    synchronized int merge(List<ListingRecord> records, int capacity) {
        fetches++;
        for (ListingRecord record : records) {
            if (record.url() == null || record.url().isBlank()) {
                continue;
            }
            if (record.slotInPage() < 0 || record.slotInPage() >= capacity) {
                continue;
            }
            Seen previous = byUrl.get(record.url());
            if (previous != null && previous.fetch() == fetches) {
                // same URL twice in one listing, first occurrence wins
                continue;
            }
            byUrl.put(record.url(), new Seen(record, fetches));
        }
        reassignSlots();
        return placed.size();
    }

    synchronized int size() {
        return placed.size();
    }

    synchronized List<ListingRecord> sortedBySlot() {
        List<ListingRecord> records = new ArrayList<>(placed.values());
        records.sort(Comparator.comparingInt(ListingRecord::slotInPage));
        return records;
    }

    private void reassignSlots() {
        List<Seen> newestFirst = new ArrayList<>(byUrl.values());
        newestFirst.sort(Comparator.comparingInt(Seen::fetch).reversed()
            .thenComparingInt(seen -> seen.record().slotInPage()));
        placed.clear();
        for (Seen seen : newestFirst) {
            placed.putIfAbsent(seen.record().slotInPage(), seen.record());
        }
    }

    private record Seen(ListingRecord record, int fetch) {
    }
}
