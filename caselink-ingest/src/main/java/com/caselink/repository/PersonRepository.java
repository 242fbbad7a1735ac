package com.caselink.repository;

import com.caselink.model.MatchCandidate;
import com.caselink.model.MissingCase;
import com.caselink.model.Person;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class PersonRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Person> PERSON_MAPPER = (rs, rowNum) -> new Person(
        rs.getLong("id"),
        rs.getLong("case_id"),
        rs.getString("role"),
        rs.getString("first_name"),
        rs.getString("last_name"),
        rs.getString("name_normalized"),
        rs.getObject("date_of_birth", LocalDate.class),
        rs.getObject("approximate_age", Integer.class),
        rs.getObject("age_min", Integer.class),
        rs.getObject("age_max", Integer.class),
        rs.getString("gender"),
        rs.getString("nationality"),
        rs.getString("ethnicity"),
        rs.getObject("height_cm", Integer.class),
        rs.getObject("weight_kg", Integer.class)
    );

    private static final RowMapper<MatchCandidate> CANDIDATE_MAPPER = (rs, rowNum) -> new MatchCandidate(
        rs.getLong("person_id"),
        rs.getLong("case_id"),
        rs.getString("case_source"),
        rs.getString("first_name"),
        rs.getString("last_name"),
        rs.getObject("date_of_birth", LocalDate.class),
        rs.getString("gender")
    );

    public PersonRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Person> findById(Long id) {
        List<Person> results = jdbc.query("SELECT * FROM persons WHERE id = ?", PERSON_MAPPER, id);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<Person> findByCaseId(Long caseId) {
        return jdbc.query("SELECT * FROM persons WHERE case_id = ? ORDER BY id", PERSON_MAPPER, caseId);
    }

    public int count() {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM persons", Integer.class);
        return count != null ? count : 0;
    }

    public Long insert(Person p) {
        String sql = """
            INSERT INTO persons (case_id, role, first_name, last_name, name_normalized, date_of_birth,
                                 approximate_age, age_min, age_max, gender, nationality, ethnicity,
                                 height_cm, weight_kg)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql, new String[] {"id"});
            ps.setLong(1, p.caseId());
            ps.setString(2, p.role());
            ps.setString(3, p.firstName());
            ps.setString(4, p.lastName());
            ps.setString(5, p.nameNormalized() != null ? p.nameNormalized() : "");
            ps.setObject(6, p.dateOfBirth(), Types.DATE);
            ps.setObject(7, p.approximateAge(), Types.INTEGER);
            ps.setObject(8, p.ageMin(), Types.INTEGER);
            ps.setObject(9, p.ageMax(), Types.INTEGER);
            ps.setString(10, p.gender());
            ps.setString(11, p.nationality());
            ps.setString(12, p.ethnicity());
            ps.setObject(13, p.heightCm(), Types.INTEGER);
            ps.setObject(14, p.weightKg(), Types.INTEGER);
            return ps;
        }, keys);
        return JdbcSupport.key(keys);
    }

    /** Null measurements keep the stored value. */
    public void refreshMeasurements(Long id, Integer heightCm, Integer weightKg) {
        jdbc.update(
            "UPDATE persons SET height_cm = COALESCE(?, height_cm), weight_kg = COALESCE(?, weight_kg) WHERE id = ?",
            heightCm, weightKg, id
        );
    }

    /**
     * Missing children on non-archived cases from every source except
     * {@code excludedSource}, lowest person id first. The date-of-birth window
     * applies only when both bounds are given.
     */
    public List<MatchCandidate> findMatchCandidates(String excludedSource, LocalDate dobFrom, LocalDate dobTo,
                                                    int limit) {
        StringBuilder sql = new StringBuilder("""
            SELECT p.id AS person_id, p.case_id, c.source AS case_source, p.first_name, p.last_name,
                   p.date_of_birth, p.gender
            FROM persons p
            JOIN cases c ON c.id = p.case_id
            WHERE p.role = ?
              AND c.status <> ?
              AND c.source <> ?
            """);
        List<Object> params = new ArrayList<>();
        params.add(Person.ROLE_MISSING_CHILD);
        params.add(MissingCase.STATUS_ARCHIVED);
        params.add(excludedSource);

        if (dobFrom != null && dobTo != null) {
            sql.append(" AND p.date_of_birth BETWEEN ? AND ?");
            params.add(dobFrom);
            params.add(dobTo);
        }

        sql.append(" ORDER BY p.id LIMIT ?");
        params.add(limit);

        return jdbc.query(sql.toString(), CANDIDATE_MAPPER, params.toArray());
    }
}
