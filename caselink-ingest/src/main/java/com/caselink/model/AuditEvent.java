package com.caselink.model;

import java.util.Map;

public record AuditEvent(
    String action,
    String resourceType,
    String resourceId,
    Map<String, Object> details
) {}
