package com.caselink.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;

@Repository
public class AuditLogRepository {

    private final JdbcTemplate jdbc;

    public AuditLogRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public void insert(String action, String resourceType, String resourceId, String details) {
        jdbc.update(
            "INSERT INTO audit_logs (action, resource_type, resource_id, details) VALUES (?, ?, ?, ?)",
            action, resourceType, resourceId, details
        );
    }

    public List<Map<String, Object>> findByAction(String action) {
        return jdbc.queryForList(
            "SELECT action, resource_type, resource_id, details FROM audit_logs WHERE action = ? ORDER BY id",
            action
        );
    }
}
