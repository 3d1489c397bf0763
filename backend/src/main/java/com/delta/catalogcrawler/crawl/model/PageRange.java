package com.delta.catalogcrawler.crawl.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive pageId range, walked from {@code startPageId} down to {@code endPageId}.
 */
public record PageRange(
    int startPageId,
    int endPageId
) {
    public PageRange {
        if (endPageId < 0 || startPageId < endPageId) {
            throw new IllegalArgumentException("invalid page range " + startPageId + ".." + endPageId);
        }
    }

    public int size() {
        return startPageId - endPageId + 1;
    }

    public boolean contains(int pageId) {
        return pageId <= startPageId && pageId >= endPageId;
    }

    public List<Integer> descendingPageIds() {
        List<Integer> ids = new ArrayList<>(size());
        for (int pageId = startPageId; pageId >= endPageId; pageId--) {
            ids.add(pageId);
        }
        return ids;
    }
}
