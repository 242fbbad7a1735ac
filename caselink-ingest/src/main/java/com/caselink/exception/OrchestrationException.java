package com.caselink.exception;

import com.caselink.model.CaseSource;

/** A run failed outside the per-record loop and was marked {@code error}. */
public class OrchestrationException extends IngestionException {

    private final CaseSource source;
    private final Long ingestionLogId;

    public OrchestrationException(CaseSource source, Long ingestionLogId, Throwable cause) {
        super("Ingestion run for " + source.slug() + " failed: " + cause.getMessage(), cause);
        this.source = source;
        this.ingestionLogId = ingestionLogId;
    }

    public CaseSource getSource() {
        return source;
    }

    public Long getIngestionLogId() {
        return ingestionLogId;
    }
}
