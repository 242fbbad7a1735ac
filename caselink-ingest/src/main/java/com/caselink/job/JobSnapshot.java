package com.caselink.job;

import com.caselink.model.IngestionResult;

import java.time.Instant;

/** Read-only view of a job for status endpoints. */
public record JobSnapshot(
    String id,
    String source,
    JobTrigger trigger,
    int priority,
    JobStatus status,
    int attempts,
    int maxAttempts,
    Instant createdAt,
    Instant finishedAt,
    String lastError,
    IngestionResult result
) {}
