package com.caselink.model;

import java.util.List;

public record IngestionResult(
    CaseSource source,
    int recordsFetched,
    int recordsInserted,
    int recordsUpdated,
    int recordsSkipped,
    int recordsFailed,
    long durationMs,
    List<RecordError> errors
) {
    public IngestionResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
