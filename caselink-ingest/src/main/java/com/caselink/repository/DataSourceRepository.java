package com.caselink.repository;

import com.caselink.model.DataSource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class DataSourceRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<DataSource> SOURCE_MAPPER = (rs, rowNum) -> new DataSource(
        rs.getLong("id"),
        rs.getString("slug"),
        rs.getString("name"),
        rs.getString("api_type"),
        rs.getBoolean("is_active"),
        rs.getInt("polling_interval_minutes"),
        JdbcSupport.instant(rs, "last_fetched_at"),
        JdbcSupport.instant(rs, "last_success_at"),
        JdbcSupport.instant(rs, "last_error_at"),
        rs.getString("last_error_message"),
        rs.getLong("total_records_fetched"),
        rs.getLong("total_records_inserted"),
        rs.getLong("total_records_updated"),
        rs.getLong("total_records_failed")
    );

    public DataSourceRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<DataSource> findBySlug(String slug) {
        List<DataSource> results = jdbc.query("SELECT * FROM data_sources WHERE slug = ?", SOURCE_MAPPER, slug);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Create the row for {@code slug} or refresh its name and polling
     * interval. Returns the row id.
     */
    public Long upsert(String slug, String name, String apiType, int pollingIntervalMinutes) {
        int updated = jdbc.update(
            "UPDATE data_sources SET name = ?, polling_interval_minutes = ? WHERE slug = ?",
            name, pollingIntervalMinutes, slug
        );
        if (updated == 0) {
            jdbc.update("""
                INSERT INTO data_sources (slug, name, api_type, is_active, polling_interval_minutes)
                VALUES (?, ?, ?, TRUE, ?)
                """,
                slug, name, apiType, pollingIntervalMinutes
            );
        }
        return jdbc.queryForObject("SELECT id FROM data_sources WHERE slug = ?", Long.class, slug);
    }

    /**
     * Add one run's counters to the running totals. Increments are applied in
     * SQL so concurrent runs never lose an update.
     */
    public void recordSuccess(Long id, Instant at, int fetched, int inserted, int updated, int failed) {
        jdbc.update("""
            UPDATE data_sources
            SET last_fetched_at = ?, last_success_at = ?, last_error_message = NULL,
                total_records_fetched = total_records_fetched + ?,
                total_records_inserted = total_records_inserted + ?,
                total_records_updated = total_records_updated + ?,
                total_records_failed = total_records_failed + ?
            WHERE id = ?
            """,
            Timestamp.from(at), Timestamp.from(at), fetched, inserted, updated, failed, id
        );
    }

    public void recordError(Long id, Instant at, String message) {
        jdbc.update(
            "UPDATE data_sources SET last_fetched_at = ?, last_error_at = ?, last_error_message = ? WHERE id = ?",
            Timestamp.from(at), Timestamp.from(at), message, id
        );
    }
}
