package com.delta.catalogcrawler.crawl.persistence;

import com.delta.catalogcrawler.crawl.model.CatalogRecord;
import com.delta.catalogcrawler.crawl.model.CrawlRunView;
import com.delta.catalogcrawler.crawl.model.FailedUnitReport;
import com.delta.catalogcrawler.crawl.model.PageUnitStatus;
import com.delta.catalogcrawler.crawl.model.RecordDetail;
import com.delta.catalogcrawler.crawl.model.SaveResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

@Repository
public class CatalogJdbcRepository implements RecordStore {
    private static final Logger log = LoggerFactory.getLogger(CatalogJdbcRepository.class);
    private static final int MAX_ERROR_LENGTH = 2000;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final boolean postgres;

    public CatalogJdbcRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.postgres = detectPostgres(jdbc);
    }

    @Override
    public int countExisting(int pageId) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(DISTINCT index_in_page)
                FROM catalog_records
                WHERE page_id = :pageId
                """,
            new MapSqlParameterSource("pageId", pageId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    @Override
    public Set<Integer> existingSlotIndices(int pageId) {
        List<Integer> indices = jdbc.queryForList(
            """
                SELECT DISTINCT index_in_page
                FROM catalog_records
                WHERE page_id = :pageId
                """,
            new MapSqlParameterSource("pageId", pageId),
            Integer.class
        );
        return new TreeSet<>(indices);
    }

    @Override
    public OptionalInt maxKnownPageId() {
        Integer max = jdbc.queryForObject(
            "SELECT MAX(page_id) FROM catalog_records",
            new MapSqlParameterSource(),
            Integer.class
        );
        return max == null ? OptionalInt.empty() : OptionalInt.of(max);
    }

    @Override
    public long totalRecordCount() {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM catalog_records", new MapSqlParameterSource(), Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public SaveResult save(List<CatalogRecord> records) {
        if (records == null || records.isEmpty()) {
            return SaveResult.empty();
        }
        int added = 0;
        int updated = 0;
        int unchanged = 0;
        int failed = 0;
        Instant now = Instant.now();
        for (CatalogRecord record : records) {
            try {
                CatalogRecord existing = findRecord(record.url());
                if (existing == null) {
                    insertRecord(record, now);
                    added++;
                } else if (samePosition(existing, record)) {
                    touchRecord(record.url(), now);
                    unchanged++;
                } else {
                    updateRecord(record, now);
                    updated++;
                }
            } catch (DataAccessException e) {
                log.warn("Failed to save record {} at page {} index {}", record.url(), record.pageId(), record.indexInPage(), e);
                failed++;
            }
        }
        return new SaveResult(added, updated, unchanged, failed);
    }

    @Override
    public SaveResult saveDetails(List<RecordDetail> details) {
        if (details == null || details.isEmpty()) {
            return SaveResult.empty();
        }
        int updated = 0;
        int unchanged = 0;
        int failed = 0;
        for (RecordDetail detail : details) {
            try {
                String json = objectMapper.writeValueAsString(detail.attributes());
                String current = jdbc.query(
                    "SELECT detail_json FROM catalog_records WHERE url = :url",
                    new MapSqlParameterSource("url", detail.url()),
                    rs -> rs.next() ? rs.getString("detail_json") : null
                );
                if (json.equals(current)) {
                    unchanged++;
                    continue;
                }
                int rows = jdbc.update(
                    """
                        UPDATE catalog_records
                        SET detail_title = :title,
                            detail_json = :json,
                            detail_fetched_at = :fetchedAt
                        WHERE url = :url
                        """,
                    new MapSqlParameterSource()
                        .addValue("title", detail.title())
                        .addValue("json", json)
                        .addValue("fetchedAt", Timestamp.from(detail.fetchedAt() == null ? Instant.now() : detail.fetchedAt()))
                        .addValue("url", detail.url())
                );
                if (rows == 0) {
                    log.warn("Detail for unknown record {}", detail.url());
                    failed++;
                } else {
                    updated++;
                }
            } catch (JsonProcessingException | DataAccessException e) {
                log.warn("Failed to save detail for {}", detail.url(), e);
                failed++;
            }
        }
        return new SaveResult(0, updated, unchanged, failed);
    }

    public CatalogRecord findRecord(String url) {
        List<CatalogRecord> rows = jdbc.query(
            """
                SELECT url, title, site_page, page_id, index_in_page
                FROM catalog_records
                WHERE url = :url
                """,
            new MapSqlParameterSource("url", url),
            recordRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public long insertCrawlRun(Instant startedAt, String status, String notes) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO crawl_runs (started_at, status, notes)
                VALUES (:startedAt, :status, :notes)
                """,
            new MapSqlParameterSource()
                .addValue("startedAt", Timestamp.from(startedAt))
                .addValue("status", status)
                .addValue("notes", notes),
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        Long id = key == null ? null : key.longValue();
        if (id == null) {
            id = jdbc.queryForObject(
                """
                    SELECT id
                    FROM crawl_runs
                    WHERE started_at = :startedAt
                      AND status = :status
                    ORDER BY id DESC
                    LIMIT 1
                    """,
                new MapSqlParameterSource()
                    .addValue("startedAt", Timestamp.from(startedAt))
                    .addValue("status", status),
                Long.class
            );
        }
        if (id == null) {
            throw new IllegalStateException("Failed to create crawl run");
        }
        return id;
    }

    public void completeCrawlRun(
        long crawlRunId,
        Instant finishedAt,
        String status,
        String notes,
        int pagesAttempted,
        int pagesSucceeded,
        int recordsCollected
    ) {
        jdbc.update(
            """
                UPDATE crawl_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    notes = :notes,
                    pages_attempted = :pagesAttempted,
                    pages_succeeded = :pagesSucceeded,
                    records_collected = :recordsCollected
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("finishedAt", Timestamp.from(finishedAt))
                .addValue("status", status)
                .addValue("notes", truncate(notes))
                .addValue("pagesAttempted", pagesAttempted)
                .addValue("pagesSucceeded", pagesSucceeded)
                .addValue("recordsCollected", recordsCollected)
                .addValue("id", crawlRunId)
        );
    }

    public void insertFailedPages(long crawlRunId, List<FailedUnitReport> failures) {
        if (failures == null || failures.isEmpty()) {
            return;
        }
        MapSqlParameterSource[] batch = failures.stream()
            .map(failure -> new MapSqlParameterSource()
                .addValue("runId", crawlRunId)
                .addValue("pageId", failure.unitId())
                .addValue("sitePage", failure.sitePage())
                .addValue("status", failure.status().name())
                .addValue("attempts", failure.attempts())
                .addValue("errors", truncate(String.join("\n", failure.errors()))))
            .toArray(MapSqlParameterSource[]::new);
        jdbc.batchUpdate(
            """
                INSERT INTO crawl_run_failed_pages (crawl_run_id, page_id, site_page, status, attempts, errors)
                VALUES (:runId, :pageId, :sitePage, :status, :attempts, :errors)
                """,
            batch
        );
    }

    public List<FailedUnitReport> findFailedPages(long crawlRunId) {
        return jdbc.query(
            """
                SELECT page_id, site_page, status, attempts, errors
                FROM crawl_run_failed_pages
                WHERE crawl_run_id = :runId
                ORDER BY page_id DESC
                """,
            new MapSqlParameterSource("runId", crawlRunId),
            (rs, rowNum) -> {
                String errors = rs.getString("errors");
                int sitePage = rs.getInt("site_page");
                return new FailedUnitReport(
                    rs.getInt("page_id"),
                    rs.wasNull() ? null : sitePage,
                    null,
                    PageUnitStatus.valueOf(rs.getString("status")),
                    rs.getInt("attempts"),
                    errors == null || errors.isBlank() ? List.of() : List.of(errors.split("\n"))
                );
            }
        );
    }

    public List<CrawlRunView> findRecentCrawlRuns(int limit) {
        return jdbc.query(
            """
                SELECT r.id, r.started_at, r.finished_at, r.status, r.notes,
                       r.pages_attempted, r.pages_succeeded, r.records_collected,
                       (SELECT COUNT(*) FROM crawl_run_failed_pages f WHERE f.crawl_run_id = r.id) AS failed_pages
                FROM crawl_runs r
                ORDER BY r.id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(1, limit)),
            (rs, rowNum) -> {
                Timestamp finished = rs.getTimestamp("finished_at");
                return new CrawlRunView(
                    rs.getLong("id"),
                    rs.getTimestamp("started_at").toInstant(),
                    finished == null ? null : finished.toInstant(),
                    rs.getString("status"),
                    rs.getString("notes"),
                    rs.getInt("pages_attempted"),
                    rs.getInt("pages_succeeded"),
                    rs.getInt("records_collected"),
                    rs.getInt("failed_pages")
                );
            }
        );
    }

    private void insertRecord(CatalogRecord record, Instant now) {
        MapSqlParameterSource params = recordParams(record).addValue("now", Timestamp.from(now));
        if (postgres) {
            jdbc.update(
                """
                    INSERT INTO catalog_records (url, title, site_page, page_id, index_in_page, first_seen_at, last_seen_at)
                    VALUES (:url, :title, :sitePage, :pageId, :indexInPage, :now, :now)
                    ON CONFLICT (url)
                    DO UPDATE SET
                        title = EXCLUDED.title,
                        site_page = EXCLUDED.site_page,
                        page_id = EXCLUDED.page_id,
                        index_in_page = EXCLUDED.index_in_page,
                        last_seen_at = EXCLUDED.last_seen_at
                    """,
                params
            );
            return;
        }
        jdbc.update(
            """
                MERGE INTO catalog_records (url, title, site_page, page_id, index_in_page, first_seen_at, last_seen_at)
                KEY(url)
                VALUES (:url, :title, :sitePage, :pageId, :indexInPage, :now, :now)
                """,
            params
        );
    }

    private void updateRecord(CatalogRecord record, Instant now) {
        jdbc.update(
            """
                UPDATE catalog_records
                SET title = :title,
                    site_page = :sitePage,
                    page_id = :pageId,
                    index_in_page = :indexInPage,
                    last_seen_at = :now
                WHERE url = :url
                """,
            recordParams(record).addValue("now", Timestamp.from(now))
        );
    }

    private void touchRecord(String url, Instant now) {
        jdbc.update(
            "UPDATE catalog_records SET last_seen_at = :now WHERE url = :url",
            new MapSqlParameterSource()
                .addValue("now", Timestamp.from(now))
                .addValue("url", url)
        );
    }

    private MapSqlParameterSource recordParams(CatalogRecord record) {
        return new MapSqlParameterSource()
            .addValue("url", record.url())
            .addValue("title", record.title())
            .addValue("sitePage", record.sitePage())
            .addValue("pageId", record.pageId())
            .addValue("indexInPage", record.indexInPage());
    }

    private boolean samePosition(CatalogRecord existing, CatalogRecord candidate) {
        return existing.pageId() == candidate.pageId()
            && existing.indexInPage() == candidate.indexInPage()
            && existing.sitePage() == candidate.sitePage()
            && Objects.equals(existing.title(), candidate.title());
    }

    private RowMapper<CatalogRecord> recordRowMapper() {
        return (rs, rowNum) -> new CatalogRecord(
            rs.getString("url"),
            rs.getString("title"),
            rs.getInt("site_page"),
            rs.getInt("page_id"),
            rs.getInt("index_in_page")
        );
    }

    private String truncate(String value) {
        if (value == null) {
            return null;
        }
        return value.length() <= MAX_ERROR_LENGTH ? value : value.substring(0, MAX_ERROR_LENGTH);
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; assuming non-Postgres", e);
            return false;
        }
    }
}
