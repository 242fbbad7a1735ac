package com.caselink.model;

import java.time.Instant;

public record IngestionLog(
    Long id,
    Long dataSourceId,
    Instant startedAt,
    Instant completedAt,
    RunStatus status,
    int recordsFetched,
    int recordsInserted,
    int recordsUpdated,
    int recordsSkipped,
    int recordsFailed,
    Long durationMs,
    String errorMessage,
    String errorDetails
) {}
