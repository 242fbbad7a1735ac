package com.caselink.job;

import com.caselink.adapter.SourceAdapters;
import com.caselink.config.IngestionProperties;
import com.caselink.model.IngestionResult;
import com.caselink.service.IngestionOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Consumes every source's queue for the lifetime of the application context.
 * Jobs are handed to the orchestrator; an exception from a run is left to
 * the queue's retry policy.
 */
@Component
public class IngestionWorker implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(IngestionWorker.class);

    private final IngestionQueues queues;
    private final SourceAdapters adapters;
    private final IngestionOrchestrator orchestrator;
    private final IngestionProperties properties;

    private volatile boolean running;

    public IngestionWorker(IngestionQueues queues, SourceAdapters adapters, IngestionOrchestrator orchestrator,
                           IngestionProperties properties) {
        this.queues = queues;
        this.adapters = adapters;
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Override
    public synchronized void start() {
        if (running) return;
        for (SourceJobQueue queue : queues.all()) {
            queue.start(this::handle);
        }
        running = true;
        log.info("Ingestion worker started for {} source(s)", queues.all().size());
    }

    /**
     * Stop intake on every queue, give in-flight runs the configured grace
     * period, then interrupt whatever is still running.
     */
    @Override
    public synchronized void stop() {
        if (!running) return;
        queues.all().forEach(SourceJobQueue::stop);

        long deadline = System.currentTimeMillis() + properties.getWorker().getShutdownTimeoutMs();
        for (SourceJobQueue queue : queues.all()) {
            try {
                long remaining = deadline - System.currentTimeMillis();
                if (!queue.awaitTermination(remaining)) {
                    queue.interrupt();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                queue.interrupt();
            }
        }
        running = false;
        log.info("Ingestion worker stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isWorkerEnabled();
    }

    IngestionResult handle(IngestionJob job) {
        return orchestrator.run(adapters.require(job.source()), job.options());
    }
}
