package com.caselink.service;

import com.caselink.adapter.SourceAdapter;
import com.caselink.adapter.SourceAdapters;
import com.caselink.exception.FetchException;
import com.caselink.job.IngestionJob;
import com.caselink.job.IngestionQueues;
import com.caselink.job.IngestionScheduler;
import com.caselink.job.JobSnapshot;
import com.caselink.job.ScheduleStatus;
import com.caselink.model.CaseSource;
import com.caselink.model.DataSource;
import com.caselink.model.FetchOptions;
import com.caselink.model.IngestionLog;
import com.caselink.model.IngestionResult;
import com.caselink.model.IngestionStatus;
import com.caselink.model.SourceStatus;
import com.caselink.repository.DataSourceRepository;
import com.caselink.repository.IngestionLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for triggering runs and reading their state, shared by the
 * REST controller and anything else that drives ingestion.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    static final int RECENT_RUNS = 10;

    private final SourceAdapters adapters;
    private final IngestionOrchestrator orchestrator;
    private final IngestionQueues queues;
    private final IngestionScheduler scheduler;
    private final DataSourceRepository dataSources;
    private final IngestionLogRepository ingestionLogs;
    private final Clock clock;

    public IngestionService(SourceAdapters adapters, IngestionOrchestrator orchestrator, IngestionQueues queues,
                            IngestionScheduler scheduler, DataSourceRepository dataSources,
                            IngestionLogRepository ingestionLogs, Clock clock) {
        this.adapters = adapters;
        this.orchestrator = orchestrator;
        this.queues = queues;
        this.scheduler = scheduler;
        this.dataSources = dataSources;
        this.ingestionLogs = ingestionLogs;
        this.clock = clock;
    }

    /**
     * Run one ingestion synchronously. Never overlaps a queued run for the
     * same source.
     *
     * @throws com.caselink.exception.UnknownSourceException if {@code sourceId} has no adapter
     * @throws com.caselink.exception.OrchestrationException if the run failed
     */
    public IngestionResult trigger(String sourceId, FetchOptions options) {
        SourceAdapter<?> adapter = adapters.require(sourceId);
        log.info("Manual ingestion triggered for {}", adapter.source().slug());
        return queues.queue(adapter.source()).runExclusive(() -> orchestrator.run(adapter, options));
    }

    /**
     * Run every registered source once, one after another. Each run holds its
     * source's lock like {@link #trigger}.
     */
    public Map<CaseSource, IngestionResult> triggerAll() {
        log.info("Manual ingestion triggered for all sources");
        return orchestrator.runAll(adapters.all(), (source, run) -> queues.queue(source).runExclusive(run));
    }

    public IngestionStatus getStatus(String sourceId) {
        SourceAdapter<?> adapter = adapters.require(sourceId);
        SourceStatus health = checkHealth(adapter);

        Optional<DataSource> dataSource = dataSources.findBySlug(adapter.source().slug());
        List<IngestionLog> recent = dataSource
            .map(ds -> ingestionLogs.findRecent(ds.id(), RECENT_RUNS))
            .orElse(List.of());

        return new IngestionStatus(health, dataSource.orElse(null), recent.isEmpty() ? null : recent.get(0), recent);
    }

    /**
     * Probe the adapter's upstream once. Never throws; failures are reported
     * in the returned status.
     */
    public SourceStatus checkHealth(SourceAdapter<?> adapter) {
        long start = clock.millis();
        boolean available = true;
        String error = null;
        try {
            adapter.probe();
        } catch (FetchException e) {
            available = false;
            error = e.getMessage();
        } catch (RuntimeException e) {
            available = false;
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Health probe for {} failed unexpectedly", adapter.source().slug(), e);
        }
        return new SourceStatus(adapter.source().slug(), adapter.sourceName(), available, clock.instant(),
            clock.millis() - start, error);
    }

    /**
     * Queue a manual run ahead of scheduled ones.
     *
     * @return the job id
     */
    public String enqueueManual(String sourceId, FetchOptions options) {
        SourceAdapter<?> adapter = adapters.require(sourceId);
        IngestionJob job = queues.submitManual(adapter.source(), options);
        return job.id();
    }

    public Optional<JobSnapshot> getJob(String jobId) {
        return queues.findJob(jobId).map(IngestionJob::snapshot);
    }

    /**
     * @return true if the job was waiting and is now cancelled
     */
    public boolean cancelJob(String jobId) {
        return queues.findJob(jobId)
            .map(job -> queues.queue(job.source()).cancel(jobId))
            .orElse(false);
    }

    public List<ScheduleStatus> getSchedules() {
        return scheduler.getScheduleStatus();
    }
}
