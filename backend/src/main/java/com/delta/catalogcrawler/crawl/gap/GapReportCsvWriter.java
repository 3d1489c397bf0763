package com.delta.catalogcrawler.crawl.gap;

import com.delta.catalogcrawler.crawl.model.GapReport;
import com.delta.catalogcrawler.crawl.model.PageGap;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * One CSV row per stored page with missing positions.
 */
@Component
public class GapReportCsvWriter {
    private static final String[] HEADER = {
        "page_id",
        "site_page",
        "expected_count",
        "actual_count",
        "missing_count",
        "completeness_ratio",
        "missing_indices"
    };

    public String write(GapReport report) {
        StringWriter out = new StringWriter();
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(HEADER).build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (PageGap gap : report.missingPages()) {
                printer.printRecord(
                    gap.pageId(),
                    gap.pageId() < report.totalPages() ? report.totalPages() - gap.pageId() : "",
                    gap.expectedCount(),
                    gap.actualCount(),
                    gap.missingIndices().size(),
                    String.format(Locale.ROOT, "%.4f", gap.completenessRatio()),
                    gap.missingIndices().stream().map(String::valueOf).collect(Collectors.joining(" "))
                );
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write gap report CSV", e);
        }
        return out.toString();
    }
}
