package com.delta.catalogcrawler.crawl.util;

import com.delta.catalogcrawler.crawl.fetch.CrawlException;
import com.delta.catalogcrawler.crawl.model.PageSlot;
import com.delta.catalogcrawler.crawl.model.SitePageSlot;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between the site's ascending page numbers (1 = oldest) and descending pageIds (0 = newest).
 *
 * <p>Stored positions are flattened from the oldest record upwards: the boundary site page 1 holds
 * {@code lastPageRecordCount} records, every later site page a full page, and the flattened sequence is cut
 * into chunks of {@code pageSize}. Chunk {@code c} is stored under pageId {@code totalPages - 1 - c}, so a
 * stored page draws from site page {@code totalPages - pageId} and, when {@code offset > 0}, spills into the
 * next newer site page for its last {@code offset} indices.
 */
public final class PageIndexMapper {
    private final int pageSize;

    public PageIndexMapper(int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        this.pageSize = pageSize;
    }

    public int pageSize() {
        return pageSize;
    }

    public static int toSitePage(int pageId, int totalPages) {
        requireTotal(totalPages);
        if (pageId < 0 || pageId >= totalPages) {
            throw CrawlException.initialization(
                "pageId " + pageId + " maps outside site pages 1.." + totalPages
            );
        }
        return totalPages - pageId;
    }

    public static int toPageId(int sitePage, int totalPages) {
        requireTotal(totalPages);
        if (sitePage < 1 || sitePage > totalPages) {
            throw CrawlException.initialization(
                "site page " + sitePage + " is outside 1.." + totalPages
            );
        }
        return totalPages - sitePage;
    }

    /**
     * Records the boundary page holds; an empty or over-full count means the page is full.
     */
    public int boundaryPageCount(int lastPageRecordCount) {
        if (lastPageRecordCount <= 0 || lastPageRecordCount >= pageSize) {
            return pageSize;
        }
        return lastPageRecordCount;
    }

    public int offset(int lastPageRecordCount) {
        return Math.floorMod(pageSize - boundaryPageCount(lastPageRecordCount), pageSize);
    }

    /**
     * Records listed on one site page.
     */
    public int sitePageCapacity(int sitePage, int lastPageRecordCount) {
        return sitePage == 1 ? boundaryPageCount(lastPageRecordCount) : pageSize;
    }

    /**
     * Records a listing fetch of the page behind {@code pageId} must yield to count as complete.
     */
    public int expectedListingCount(int pageId, int totalPages, int lastPageRecordCount) {
        return sitePageCapacity(toSitePage(pageId, totalPages), lastPageRecordCount);
    }

    /**
     * Records storage must hold under {@code pageId} once every position is filled.
     */
    public int expectedStoredCount(int pageId, int offset) {
        if (pageId < 0) {
            throw new IllegalArgumentException("pageId must not be negative: " + pageId);
        }
        return pageId == 0 ? pageSize - offset : pageSize;
    }

    public PageSlot mapSlot(int sitePage, int slotInPage, int offset, int totalPages) {
        requireTotal(totalPages);
        if (sitePage < 1 || sitePage > totalPages) {
            throw CrawlException.initialization("site page " + sitePage + " is outside 1.." + totalPages);
        }
        int capacity = sitePage == 1 ? pageSize - offset : pageSize;
        if (slotInPage < 0 || slotInPage >= capacity) {
            throw new IllegalArgumentException(
                "slot " + slotInPage + " outside site page " + sitePage + " capacity " + capacity
            );
        }
        long absolute = sitePage == 1
            ? slotInPage
            : (long) pageSize * (sitePage - 1) + slotInPage - offset;
        int chunk = (int) (absolute / pageSize);
        return new PageSlot(totalPages - 1 - chunk, (int) (absolute % pageSize));
    }

    public SitePageSlot unmapSlot(int pageId, int indexInPage, int offset, int totalPages) {
        requireTotal(totalPages);
        if (pageId < 0 || pageId >= totalPages) {
            throw CrawlException.initialization("pageId " + pageId + " maps outside site pages 1.." + totalPages);
        }
        if (indexInPage < 0 || indexInPage >= expectedStoredCount(pageId, offset)) {
            throw new IllegalArgumentException("index " + indexInPage + " outside stored page " + pageId);
        }
        long absolute = (long) (totalPages - 1 - pageId) * pageSize + indexInPage;
        int boundary = pageSize - offset;
        if (absolute < boundary) {
            return new SitePageSlot(1, (int) absolute);
        }
        long shifted = absolute + offset;
        return new SitePageSlot((int) (shifted / pageSize) + 1, (int) (shifted % pageSize));
    }

    /**
     * Site pages that feed the stored page, oldest first.
     */
    public List<Integer> sitePagesFor(int pageId, int offset, int totalPages) {
        int sitePage = toSitePage(pageId, totalPages);
        List<Integer> pages = new ArrayList<>(2);
        pages.add(sitePage);
        if (offset > 0 && sitePage + 1 <= totalPages) {
            pages.add(sitePage + 1);
        }
        return pages;
    }

    private static void requireTotal(int totalPages) {
        if (totalPages <= 0) {
            throw CrawlException.initialization("totalPages must be positive: " + totalPages);
        }
    }
}
