package com.caselink.repository;

import com.caselink.model.CaseSourceRecord;
import com.caselink.model.ExactMatch;
import com.caselink.model.Person;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Provenance rows: which source records have been seen for which case.
 */
@Repository
public class CaseSourceRecordRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<CaseSourceRecord> RECORD_MAPPER = (rs, rowNum) -> new CaseSourceRecord(
        rs.getLong("id"),
        rs.getLong("case_id"),
        rs.getString("source_slug"),
        rs.getString("source_id"),
        rs.getString("source_url"),
        JdbcSupport.instant(rs, "fetched_at"),
        rs.getString("raw_data")
    );

    private static final RowMapper<ExactMatch> MATCH_MAPPER = (rs, rowNum) -> new ExactMatch(
        rs.getLong("case_id"),
        rs.getLong("person_id"),
        rs.getLong("record_id"),
        rs.getBoolean("originating")
    );

    public CaseSourceRecordRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Look up a previous ingestion of the same source record. When the record
     * is both a case's origin and attached elsewhere, the originating case
     * wins.
     */
    public Optional<ExactMatch> findExactMatch(String sourceSlug, String sourceId) {
        List<ExactMatch> results = jdbc.query("""
            SELECT r.case_id, r.id AS record_id, p.id AS person_id,
                   CASE WHEN c.source = r.source_slug AND c.source_id = r.source_id THEN TRUE ELSE FALSE END
                       AS originating
            FROM case_source_records r
            JOIN cases c ON c.id = r.case_id
            JOIN persons p ON p.case_id = c.id AND p.role = ?
            WHERE r.source_slug = ? AND r.source_id = ?
            ORDER BY originating DESC, r.id, p.id
            """,
            MATCH_MAPPER, Person.ROLE_MISSING_CHILD, sourceSlug, sourceId
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<CaseSourceRecord> findByCaseId(Long caseId) {
        return jdbc.query(
            "SELECT * FROM case_source_records WHERE case_id = ? ORDER BY id",
            RECORD_MAPPER, caseId
        );
    }

    public int count() {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM case_source_records", Integer.class);
        return count != null ? count : 0;
    }

    public void insert(Long caseId, String sourceSlug, String sourceId, String sourceUrl,
                       Instant fetchedAt, String rawData) {
        jdbc.update("""
            INSERT INTO case_source_records (case_id, source_slug, source_id, source_url, fetched_at, raw_data)
            VALUES (?, ?, ?, ?, ?, ?)
            """,
            caseId, sourceSlug, sourceId, sourceUrl, Timestamp.from(fetchedAt), rawData
        );
    }

    public void refresh(Long id, Instant fetchedAt, String rawData) {
        jdbc.update(
            "UPDATE case_source_records SET fetched_at = ?, raw_data = ? WHERE id = ?",
            Timestamp.from(fetchedAt), rawData, id
        );
    }

    /**
     * Attach a source record to a case, or refresh it if already attached.
     */
    public void upsert(Long caseId, String sourceSlug, String sourceId, String sourceUrl,
                       Instant fetchedAt, String rawData) {
        int updated = jdbc.update("""
            UPDATE case_source_records SET fetched_at = ?, raw_data = ?
            WHERE case_id = ? AND source_slug = ? AND source_id = ?
            """,
            Timestamp.from(fetchedAt), rawData, caseId, sourceSlug, sourceId
        );
        if (updated == 0) {
            insert(caseId, sourceSlug, sourceId, sourceUrl, fetchedAt, rawData);
        }
    }
}
