package com.caselink.job;

import com.caselink.adapter.SourceAdapters;
import com.caselink.config.IngestionProperties;
import com.caselink.exception.UnknownSourceException;
import com.caselink.model.CaseSource;
import com.caselink.model.FetchOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * One {@link SourceJobQueue} per registered adapter, so sources run
 * independently of each other.
 */
@Component
public class IngestionQueues {

    private final Map<CaseSource, SourceJobQueue> queues = new EnumMap<>(CaseSource.class);
    private final IngestionProperties.Worker worker;

    public IngestionQueues(SourceAdapters adapters, IngestionProperties properties,
                           @Qualifier("ingestionTaskScheduler") TaskScheduler taskScheduler, Clock clock) {
        this.worker = properties.getWorker();
        for (CaseSource source : adapters.sources()) {
            queues.put(source, new SourceJobQueue(source, worker.getRateWindowMs(), worker.getRetainedJobs(),
                taskScheduler, clock));
        }
    }

    /**
     * @throws UnknownSourceException if no adapter is registered for {@code source}
     */
    public SourceJobQueue queue(CaseSource source) {
        SourceJobQueue queue = queues.get(source);
        if (queue == null) {
            throw new UnknownSourceException(source.slug());
        }
        return queue;
    }

    public Collection<SourceJobQueue> all() {
        return Collections.unmodifiableCollection(queues.values());
    }

    public IngestionJob submitManual(CaseSource source, FetchOptions options) {
        return queue(source).submit(options, JobTrigger.MANUAL, worker.getManualAttempts(),
            worker.getManualBackoffMs());
    }

    public IngestionJob submitScheduled(CaseSource source) {
        return queue(source).submit(FetchOptions.defaults(), JobTrigger.SCHEDULED, worker.getScheduledAttempts(),
            worker.getScheduledBackoffMs());
    }

    public Optional<IngestionJob> findJob(String jobId) {
        for (SourceJobQueue queue : queues.values()) {
            Optional<IngestionJob> job = queue.find(jobId);
            if (job.isPresent()) return job;
        }
        return Optional.empty();
    }
}
