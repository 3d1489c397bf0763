package com.delta.catalogcrawler.crawl.gap;

import com.delta.catalogcrawler.crawl.model.GapReport;
import com.delta.catalogcrawler.crawl.model.PageGap;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GapReportCsvWriterTest {

    @Test
    void writesOneRowPerPageWithSitePageAndSpaceSeparatedIndices() {
        GapReport report = new GapReport(
            20,
            12,
            0,
            false,
            10,
            List.of(
                new PageGap(3, List.of(0, 1, 2), 12, 9, 0.75),
                new PageGap(10, List.of(4), 12, 11, 11.0 / 12)
            ),
            List.of(),
            List.of(3, 10),
            4,
            132,
            128,
            96.97,
            List.of(),
            null,
            Instant.parse("2026-03-01T10:00:00Z")
        );

        String csv = new GapReportCsvWriter().write(report);

        assertThat(csv.split("\r\n")).containsExactly(
            "page_id,site_page,expected_count,actual_count,missing_count,completeness_ratio,missing_indices",
            "3,17,12,9,3,0.7500,0 1 2",
            "10,10,12,11,1,0.9167,4"
        );
    }

    @Test
    void completeReportHasOnlyHeader() {
        GapReport report = new GapReport(
            5, 12, 0, false, 4, List.of(), List.of(), List.of(), 0, 60, 60, 100.0, List.of(), null, Instant.now()
        );

        assertThat(new GapReportCsvWriter().write(report).trim())
            .isEqualTo("page_id,site_page,expected_count,actual_count,missing_count,completeness_ratio,missing_indices");
    }
}
