package com.delta.catalogcrawler.crawl.persistence;

import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.RecordDetail;
import com.delta.catalogcrawler.crawl.model.SaveResult;

import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Positions of stored records, keyed by pageId and index within the page.
 */
public interface RecordStore {
    int countExisting(int pageId);

    Set<Integer> existingSlotIndices(int pageId);

    OptionalInt maxKnownPageId();

    long totalRecordCount();

    SaveResult save(List<CatalogRecord> records);

    SaveResult saveDetails(List<RecordDetail> details);
}
