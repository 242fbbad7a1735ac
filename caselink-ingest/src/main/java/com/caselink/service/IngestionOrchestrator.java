package com.caselink.service;

import com.caselink.adapter.SourceAdapter;
import com.caselink.exception.OrchestrationException;
import com.caselink.model.AuditEvent;
import com.caselink.model.CaseSource;
import com.caselink.model.DeduplicationDecision;
import com.caselink.model.FetchOptions;
import com.caselink.model.IngestionResult;
import com.caselink.model.NormalizedCase;
import com.caselink.model.RecordError;
import com.caselink.repository.DataSourceRepository;
import com.caselink.repository.IngestionLogRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs one ingestion for one source: fetch, then normalize, deduplicate,
 * score and store each record in turn. A bad record is counted and skipped;
 * only failures outside the record loop end the run, and those are recorded
 * on the run's log before being rethrown.
 */
@Service
public class IngestionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(IngestionOrchestrator.class);

    static final int MAX_RECORDED_ERRORS = 50;
    static final int MAX_DATA_SOURCE_ERROR_LENGTH = 500;
    static final int MAX_LOG_ERROR_LENGTH = 1000;
    public static final String AUDIT_ACTION = "data_sources.trigger";
    public static final String AUDIT_RESOURCE = "ingestion_log";

    private enum Outcome { INSERTED, UPDATED, SKIPPED }

    private final DataSourceRepository dataSources;
    private final IngestionLogRepository ingestionLogs;
    private final Deduplicator deduplicator;
    private final QualityScorer qualityScorer;
    private final CaseWriter caseWriter;
    private final AuditLogService auditLog;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public IngestionOrchestrator(DataSourceRepository dataSources, IngestionLogRepository ingestionLogs,
                                 Deduplicator deduplicator, QualityScorer qualityScorer, CaseWriter caseWriter,
                                 AuditLogService auditLog, ObjectMapper objectMapper, Clock clock) {
        this.dataSources = dataSources;
        this.ingestionLogs = ingestionLogs;
        this.deduplicator = deduplicator;
        this.qualityScorer = qualityScorer;
        this.caseWriter = caseWriter;
        this.auditLog = auditLog;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @throws OrchestrationException if the run failed as a whole; the run's
     *         log row is already marked {@code error}
     */
    public <R> IngestionResult run(SourceAdapter<R> adapter, FetchOptions options) {
        CaseSource source = adapter.source();
        long started = clock.millis();

        Long dataSourceId = dataSources.upsert(source.slug(), adapter.sourceName(), adapter.apiType(),
            adapter.pollingIntervalMinutes());
        Long logId = ingestionLogs.start(dataSourceId, Instant.ofEpochMilli(started));
        log.info("Ingestion started for {} (log {})", source.slug(), logId);

        try {
            List<R> raws = adapter.fetch(options != null ? options : FetchOptions.defaults());
            log.info("Fetched {} records from {}", raws.size(), source.slug());

            int inserted = 0;
            int updated = 0;
            int skipped = 0;
            int failed = 0;
            List<RecordError> errors = new ArrayList<>();

            for (R raw : raws) {
                String externalId = null;
                try {
                    NormalizedCase record = adapter.normalize(raw);
                    externalId = record.externalId();
                    switch (process(record)) {
                        case INSERTED -> inserted++;
                        case UPDATED -> updated++;
                        case SKIPPED -> skipped++;
                    }
                } catch (RuntimeException e) {
                    failed++;
                    if (errors.size() < MAX_RECORDED_ERRORS) {
                        errors.add(new RecordError(externalId, e.getMessage()));
                    }
                    log.warn("Record {} from {} failed: {}", externalId, source.slug(), e.getMessage());
                }
            }

            long durationMs = clock.millis() - started;
            Instant completed = clock.instant();
            IngestionResult result = new IngestionResult(source, raws.size(), inserted, updated, skipped, failed,
                durationMs, errors);

            dataSources.recordSuccess(dataSourceId, completed, raws.size(), inserted, updated, failed);
            ingestionLogs.completeSuccess(logId, completed, raws.size(), inserted, updated, skipped, failed,
                durationMs, errors.isEmpty() ? null : toJson(errors));

            auditLog.record(new AuditEvent(AUDIT_ACTION, AUDIT_RESOURCE, String.valueOf(logId), auditDetails(result)));

            log.info("Ingestion complete for {}: {} new, {} updated, {} duplicates, {} failed in {} ms",
                source.slug(), inserted, updated, skipped, failed, durationMs);
            return result;
        } catch (RuntimeException e) {
            fail(dataSourceId, logId, started, e);
            throw new OrchestrationException(source, logId, e);
        }
    }

    /**
     * Wraps one source's run, e.g. to keep it from overlapping a queued job
     * for the same source.
     */
    @FunctionalInterface
    public interface RunGuard {
        IngestionResult guard(CaseSource source, Supplier<IngestionResult> run);
    }

    /**
     * Run each adapter in turn through {@code guard}. A failing source is
     * logged and left out of the returned map; the others still run.
     */
    public Map<CaseSource, IngestionResult> runAll(List<? extends SourceAdapter<?>> adapters, RunGuard guard) {
        Map<CaseSource, IngestionResult> results = new EnumMap<>(CaseSource.class);
        for (SourceAdapter<?> adapter : adapters) {
            try {
                results.put(adapter.source(),
                    guard.guard(adapter.source(), () -> run(adapter, FetchOptions.defaults())));
            } catch (OrchestrationException e) {
                log.error("Ingestion failed for {}: {}", adapter.source().slug(), e.getMessage());
            }
        }
        return results;
    }

    private Outcome process(NormalizedCase record) {
        DeduplicationDecision decision = deduplicator.deduplicate(record);

        if (decision.isExactMatch()) {
            caseWriter.refresh(decision.exactMatch(), record, qualityScorer.score(record).score());
            return Outcome.UPDATED;
        }

        if (decision.duplicate() && decision.existingCaseId() != null) {
            caseWriter.attach(decision.existingCaseId(), record);
            return Outcome.SKIPPED;
        }

        caseWriter.create(record, qualityScorer.score(record).score());
        return Outcome.INSERTED;
    }

    private void fail(Long dataSourceId, Long logId, long started, RuntimeException cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        Instant now = clock.instant();
        long durationMs = clock.millis() - started;
        log.error("Ingestion failed (log {}) after {} ms", logId, durationMs, cause);

        try {
            dataSources.recordError(dataSourceId, now, truncate(message, MAX_DATA_SOURCE_ERROR_LENGTH));
            ingestionLogs.completeError(logId, now, durationMs, truncate(message, MAX_LOG_ERROR_LENGTH),
                toJson(Map.of("error", message)));
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("Could not record failure for log {}: {}", logId, e.getMessage());
        }
    }

    private Map<String, Object> auditDetails(IngestionResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", result.source().slug());
        details.put("recordsFetched", result.recordsFetched());
        details.put("recordsInserted", result.recordsInserted());
        details.put("recordsUpdated", result.recordsUpdated());
        details.put("recordsSkipped", result.recordsSkipped());
        details.put("recordsFailed", result.recordsFailed());
        details.put("durationMs", result.durationMs());
        return details;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize error details", e);
        }
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
