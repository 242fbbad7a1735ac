package com.caselink.model;

import java.time.Instant;

/** Health report from a single probe of an adapter's upstream. */
public record SourceStatus(
    String sourceId,
    String sourceName,
    boolean available,
    Instant lastCheckedAt,
    long latencyMs,
    String error
) {}
