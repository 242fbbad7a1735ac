package com.caselink.service;

import com.caselink.model.AuditEvent;
import com.caselink.repository.AuditLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Best-effort audit trail. Writes happen off the caller's thread and a
 * failed write is logged, never reported back.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private final AuditLogRepository auditLogs;
    private final ObjectMapper objectMapper;

    public AuditLogService(AuditLogRepository auditLogs, ObjectMapper objectMapper) {
        this.auditLogs = auditLogs;
        this.objectMapper = objectMapper;
    }

    @Async("auditExecutor")
    public void record(AuditEvent event) {
        try {
            String details = objectMapper.writeValueAsString(event.details());
            auditLogs.insert(event.action(), event.resourceType(), event.resourceId(), details);
        } catch (JsonProcessingException | DataAccessException e) {
            log.warn("Failed to write audit event {} for {} {}: {}",
                event.action(), event.resourceType(), event.resourceId(), e.getMessage());
        }
    }
}
