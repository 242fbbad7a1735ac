package com.caselink.model;

import java.time.Instant;

public record DataSource(
    Long id,
    String slug,
    String name,
    String apiType,
    boolean active,
    int pollingIntervalMinutes,
    Instant lastFetchedAt,
    Instant lastSuccessAt,
    Instant lastErrorAt,
    String lastErrorMessage,
    long totalRecordsFetched,
    long totalRecordsInserted,
    long totalRecordsUpdated,
    long totalRecordsFailed
) {}
