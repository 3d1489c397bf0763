package com.delta.catalogcrawler.crawl.util;

import com.delta.catalogcrawler.crawl.fetch.CrawlErrorKind;
import com.delta.catalogcrawler.crawl.fetch.CrawlException;
import com.delta.catalogcrawler.crawl.model.PageSlot;
import com.delta.catalogcrawler.crawl.model.SitePageSlot;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageIndexMapperTest {
    private final PageIndexMapper mapper = new PageIndexMapper(12);

    @Test
    void oldestPageIdMapsToBoundarySitePage() {
        assertThat(PageIndexMapper.toSitePage(9, 10)).isEqualTo(1);
        assertThat(PageIndexMapper.toSitePage(0, 10)).isEqualTo(10);
        assertThat(PageIndexMapper.toPageId(1, 10)).isEqualTo(9);
        assertThat(PageIndexMapper.toPageId(10, 10)).isEqualTo(0);
    }

    @Test
    void boundaryPageExpectsLastPageCountAndOthersExpectFullPage() {
        assertThat(mapper.expectedListingCount(9, 10, 5)).isEqualTo(5);
        for (int pageId = 0; pageId < 9; pageId++) {
            assertThat(mapper.expectedListingCount(pageId, 10, 5)).isEqualTo(12);
        }
    }

    @Test
    void emptyOrFullBoundaryPageCountsAsFull() {
        assertThat(mapper.boundaryPageCount(0)).isEqualTo(12);
        assertThat(mapper.boundaryPageCount(12)).isEqualTo(12);
        assertThat(mapper.boundaryPageCount(40)).isEqualTo(12);
        assertThat(mapper.offset(0)).isZero();
        assertThat(mapper.offset(12)).isZero();
        assertThat(mapper.offset(5)).isEqualTo(7);
    }

    @Test
    void outOfRangePageIdIsAnInitializationFailure() {
        assertThatThrownBy(() -> PageIndexMapper.toSitePage(10, 10))
            .isInstanceOfSatisfying(CrawlException.class, e -> assertThat(e.kind()).isEqualTo(CrawlErrorKind.INITIALIZATION));
        assertThatThrownBy(() -> PageIndexMapper.toSitePage(-1, 10))
            .isInstanceOf(CrawlException.class);
        assertThatThrownBy(() -> PageIndexMapper.toPageId(0, 10))
            .isInstanceOf(CrawlException.class);
        assertThatThrownBy(() -> mapper.unmapSlot(10, 0, 7, 10))
            .isInstanceOf(CrawlException.class);
    }

    @Test
    void newerSitePagesSpillAcrossStoredPagesByOffset() {
        int offset = mapper.offset(5);

        assertThat(mapper.mapSlot(1, 4, offset, 10)).isEqualTo(new PageSlot(9, 4));
        assertThat(mapper.mapSlot(2, 0, offset, 10)).isEqualTo(new PageSlot(9, 5));
        assertThat(mapper.mapSlot(2, 6, offset, 10)).isEqualTo(new PageSlot(9, 11));
        assertThat(mapper.mapSlot(2, 7, offset, 10)).isEqualTo(new PageSlot(8, 0));
        assertThat(mapper.mapSlot(10, 11, offset, 10)).isEqualTo(new PageSlot(0, 4));
        assertThat(mapper.expectedStoredCount(0, offset)).isEqualTo(5);
        assertThat(mapper.sitePagesFor(9, offset, 10)).isEqualTo(List.of(1, 2));
        assertThat(mapper.sitePagesFor(0, offset, 10)).isEqualTo(List.of(10));
    }

    @Test
    void everyListedSlotHasOneStoredPositionAndMapsBack() {
        int totalPages = 10;
        int lastPageRecordCount = 5;
        int offset = mapper.offset(lastPageRecordCount);
        Set<PageSlot> seen = new HashSet<>();
        for (int sitePage = 1; sitePage <= totalPages; sitePage++) {
            int capacity = mapper.sitePageCapacity(sitePage, lastPageRecordCount);
            for (int slot = 0; slot < capacity; slot++) {
                PageSlot position = mapper.mapSlot(sitePage, slot, offset, totalPages);
                assertThat(seen.add(position)).isTrue();
                assertThat(position.indexInPage()).isLessThan(mapper.expectedStoredCount(position.pageId(), offset));
                assertThat(mapper.unmapSlot(position.pageId(), position.indexInPage(), offset, totalPages))
                    .isEqualTo(new SitePageSlot(sitePage, slot));
            }
        }
        assertThat(seen).hasSize(9 * 12 + 5);
    }
}
