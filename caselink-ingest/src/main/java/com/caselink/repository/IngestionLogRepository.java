package com.caselink.repository;

import com.caselink.model.IngestionLog;
import com.caselink.model.RunStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One row per run. A row leaves {@code running} exactly once; the finalize
 * statements only match running rows.
 */
@Repository
public class IngestionLogRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<IngestionLog> LOG_MAPPER = (rs, rowNum) -> new IngestionLog(
        rs.getLong("id"),
        rs.getLong("data_source_id"),
        JdbcSupport.instant(rs, "started_at"),
        JdbcSupport.instant(rs, "completed_at"),
        RunStatus.fromDbValue(rs.getString("status")),
        rs.getInt("records_fetched"),
        rs.getInt("records_inserted"),
        rs.getInt("records_updated"),
        rs.getInt("records_skipped"),
        rs.getInt("records_failed"),
        rs.getObject("duration_ms", Long.class),
        rs.getString("error_message"),
        rs.getString("error_details")
    );

    public IngestionLogRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Long start(Long dataSourceId, Instant startedAt) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                "INSERT INTO ingestion_logs (data_source_id, started_at, status) VALUES (?, ?, ?)",
                new String[] {"id"});
            ps.setLong(1, dataSourceId);
            ps.setTimestamp(2, Timestamp.from(startedAt));
            ps.setString(3, RunStatus.RUNNING.dbValue());
            return ps;
        }, keys);
        return JdbcSupport.key(keys);
    }

    /** @return false if the row was already terminal */
    public boolean completeSuccess(Long id, Instant completedAt, int fetched, int inserted, int updated,
                                   int skipped, int failed, long durationMs, String errorDetails) {
        return jdbc.update("""
            UPDATE ingestion_logs
            SET completed_at = ?, status = ?, records_fetched = ?, records_inserted = ?, records_updated = ?,
                records_skipped = ?, records_failed = ?, duration_ms = ?, error_details = ?
            WHERE id = ? AND status = ?
            """,
            Timestamp.from(completedAt), RunStatus.SUCCESS.dbValue(), fetched, inserted, updated,
            skipped, failed, durationMs, errorDetails, id, RunStatus.RUNNING.dbValue()
        ) == 1;
    }

    /** @return false if the row was already terminal */
    public boolean completeError(Long id, Instant completedAt, long durationMs, String errorMessage,
                                 String errorDetails) {
        return jdbc.update("""
            UPDATE ingestion_logs
            SET completed_at = ?, status = ?, duration_ms = ?, error_message = ?, error_details = ?
            WHERE id = ? AND status = ?
            """,
            Timestamp.from(completedAt), RunStatus.ERROR.dbValue(), durationMs, errorMessage, errorDetails,
            id, RunStatus.RUNNING.dbValue()
        ) == 1;
    }

    public Optional<IngestionLog> findById(Long id) {
        List<IngestionLog> results = jdbc.query("SELECT * FROM ingestion_logs WHERE id = ?", LOG_MAPPER, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<IngestionLog> findRecent(Long dataSourceId, int limit) {
        return jdbc.query(
            "SELECT * FROM ingestion_logs WHERE data_source_id = ? ORDER BY started_at DESC, id DESC LIMIT ?",
            LOG_MAPPER, dataSourceId, limit
        );
    }
}
