package com.caselink.job;

import com.caselink.adapter.SourceAdapters;
import com.caselink.config.IngestionProperties;
import com.caselink.config.IngestionProperties.SourceDefinition;
import com.caselink.model.CaseSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Cron-driven enqueueing of scheduled ingestion jobs, one schedule per
 * enabled source under the key {@code <source>-scheduled}. Registering a key
 * again replaces its previous schedule.
 */
@Component
public class IngestionScheduler {

    private static final Logger log = LoggerFactory.getLogger(IngestionScheduler.class);

    static final Map<CaseSource, String> DEFAULT_CRONS = Map.of(
        CaseSource.FBI, "0 0 */6 * * *",
        CaseSource.INTERPOL, "0 30 */6 * * *",
        CaseSource.NCMEC, "0 0 * * * *",
        CaseSource.AMBER, "0 */15 * * * *"
    );

    private record Registration(CaseSource source, String cron, ScheduledFuture<?> future) {}

    private final TaskScheduler taskScheduler;
    private final IngestionQueues queues;
    private final SourceAdapters adapters;
    private final IngestionProperties properties;
    private final Clock clock;
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    public IngestionScheduler(@Qualifier("ingestionTaskScheduler") TaskScheduler taskScheduler,
                              IngestionQueues queues, SourceAdapters adapters, IngestionProperties properties,
                              Clock clock) {
        this.taskScheduler = taskScheduler;
        this.queues = queues;
        this.adapters = adapters;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isSchedulingEnabled()) {
            log.info("Ingestion scheduling disabled");
            return;
        }
        registerAll();
    }

    /**
     * Register a schedule for every enabled source that has an adapter.
     *
     * @return the number of schedules registered
     */
    public int registerAll() {
        int count = 0;
        for (CaseSource source : adapters.sources()) {
            SourceDefinition def = properties.getSource(source);
            if (!def.isEnabled()) {
                log.info("Source {} disabled, not scheduling", source.slug());
                continue;
            }
            String cron = def.getCron() != null && !def.getCron().isBlank() ? def.getCron() : DEFAULT_CRONS.get(source);
            if (cron == null) {
                log.warn("No cron configured for {}, not scheduling", source.slug());
                continue;
            }
            schedule(source, cron);
            count++;
        }
        log.info("Registered {} ingestion schedule(s)", count);
        return count;
    }

    /**
     * Idempotent: an existing schedule for the same source is cancelled first.
     *
     * @throws IllegalArgumentException if {@code cron} is not a valid cron expression
     */
    public synchronized void schedule(CaseSource source, String cron) {
        CronTrigger trigger = new CronTrigger(cron, ZoneOffset.UTC);
        String key = key(source);

        Registration previous = registrations.remove(key);
        if (previous != null) {
            previous.future().cancel(false);
        }

        ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(source), trigger);
        registrations.put(key, new Registration(source, cron, future));
        log.info("Scheduled {} with cron '{}'", key, cron);
    }

    public List<ScheduleStatus> getScheduleStatus() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));
        List<ScheduleStatus> statuses = new ArrayList<>();
        registrations.forEach((key, registration) -> statuses.add(new ScheduleStatus(
            key,
            registration.source().slug(),
            registration.cron(),
            CronExpression.parse(registration.cron()).next(now)
        )));
        statuses.sort((a, b) -> a.key().compareTo(b.key()));
        return statuses;
    }

    public synchronized void clearSchedules() {
        registrations.values().forEach(r -> r.future().cancel(false));
        int count = registrations.size();
        registrations.clear();
        log.info("Cleared {} ingestion schedule(s)", count);
    }

    static String key(CaseSource source) {
        return source.slug() + "-scheduled";
    }

    void fire(CaseSource source) {
        try {
            IngestionJob job = queues.submitScheduled(source);
            log.info("Scheduled ingestion for {} queued as job {}", source.slug(), job.id());
        } catch (IllegalStateException e) {
            log.warn("Skipped scheduled ingestion for {}: {}", source.slug(), e.getMessage());
        }
    }
}
