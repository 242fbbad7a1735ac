package com.caselink.repository;

import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/** Column conversions shared by the row mappers. */
final class JdbcSupport {

    private JdbcSupport() {
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Long key(KeyHolder keys) {
        Number key = keys.getKey();
        if (key == null) {
            throw new DataRetrievalFailureException("Insert returned no generated id");
        }
        return key.longValue();
    }
}
