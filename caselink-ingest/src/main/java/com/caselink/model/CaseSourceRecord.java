package com.caselink.model;

import java.time.Instant;

public record CaseSourceRecord(
    Long id,
    Long caseId,
    String sourceSlug,
    String sourceId,
    String sourceUrl,
    Instant fetchedAt,
    String rawData
) {}
