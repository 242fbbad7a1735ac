package com.caselink.repository;

import com.caselink.model.MissingCase;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public class CaseRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<MissingCase> CASE_MAPPER = (rs, rowNum) -> new MissingCase(
        rs.getLong("id"),
        rs.getString("case_number"),
        rs.getString("case_type"),
        rs.getString("status"),
        rs.getString("urgency"),
        rs.getInt("quality_score"),
        JdbcSupport.instant(rs, "reported_at"),
        rs.getString("source"),
        rs.getString("source_id"),
        rs.getString("source_url"),
        rs.getObject("last_seen_at", LocalDate.class),
        rs.getString("last_seen_location"),
        rs.getObject("last_seen_lat", Double.class),
        rs.getObject("last_seen_lng", Double.class),
        rs.getString("last_seen_country"),
        rs.getString("circumstances"),
        JdbcSupport.instant(rs, "last_synced_at")
    );

    public CaseRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<MissingCase> findById(Long id) {
        List<MissingCase> results = jdbc.query("SELECT * FROM cases WHERE id = ?", CASE_MAPPER, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<MissingCase> findBySource(String source) {
        return jdbc.query("SELECT * FROM cases WHERE source = ? ORDER BY id", CASE_MAPPER, source);
    }

    public int count() {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM cases", Integer.class);
        return count != null ? count : 0;
    }

    public Long insert(MissingCase c) {
        String sql = """
            INSERT INTO cases (case_number, case_type, status, urgency, quality_score, reported_at,
                               source, source_id, source_url, last_seen_at, last_seen_location,
                               last_seen_lat, last_seen_lng, last_seen_country, circumstances, last_synced_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, new String[] {"id"});
            ps.setString(1, c.caseNumber());
            ps.setString(2, c.caseType());
            ps.setString(3, c.status());
            ps.setString(4, c.urgency());
            ps.setInt(5, c.qualityScore());
            ps.setTimestamp(6, Timestamp.from(c.reportedAt()));
            ps.setString(7, c.source());
            ps.setString(8, c.sourceId());
            ps.setString(9, c.sourceUrl());
            ps.setObject(10, c.lastSeenAt(), Types.DATE);
            ps.setString(11, c.lastSeenLocation());
            ps.setObject(12, c.lastSeenLat(), Types.DOUBLE);
            ps.setObject(13, c.lastSeenLng(), Types.DOUBLE);
            ps.setString(14, c.lastSeenCountry());
            ps.setString(15, c.circumstances());
            ps.setTimestamp(16, JdbcSupport.timestamp(c.lastSyncedAt()));
            return ps;
        }, keys);
        return JdbcSupport.key(keys);
    }

    /**
     * Refresh a case from its originating source. Null inputs keep the stored
     * value.
     */
    public void refresh(Long id, int qualityScore, String circumstances, String lastSeenLocation,
                        String sourceUrl, Instant syncedAt) {
        jdbc.update("""
            UPDATE cases
            SET quality_score = ?,
                circumstances = COALESCE(?, circumstances),
                last_seen_location = COALESCE(?, last_seen_location),
                source_url = COALESCE(?, source_url),
                last_synced_at = ?
            WHERE id = ?
            """,
            qualityScore, circumstances, lastSeenLocation, sourceUrl, Timestamp.from(syncedAt), id
        );
    }

    public void updateStatus(Long id, String status) {
        jdbc.update("UPDATE cases SET status = ? WHERE id = ?", status, id);
    }
}
