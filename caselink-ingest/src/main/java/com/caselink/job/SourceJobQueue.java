package com.caselink.job;

import com.caselink.model.CaseSource;
import com.caselink.model.FetchOptions;
import com.caselink.model.IngestionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process job queue for one source. A single consumer thread takes jobs
 * in priority order (then submission order) and starts at most one job per
 * rate window. Failed jobs come back after an exponential backoff until
 * their attempts run out.
 */
public class SourceJobQueue {

    private static final Logger log = LoggerFactory.getLogger(SourceJobQueue.class);
    private static final long POLL_INTERVAL_MS = 200;

    /** Runs one job; a thrown exception counts as a failed attempt. */
    @FunctionalInterface
    public interface JobHandler {
        IngestionResult handle(IngestionJob job);
    }

    private record Entry(IngestionJob job, long sequence) {}

    private final CaseSource source;
    private final long rateWindowMs;
    private final int retainedJobs;
    private final TaskScheduler retryScheduler;
    private final Clock clock;

    private final PriorityBlockingQueue<Entry> waiting = new PriorityBlockingQueue<>(16,
        Comparator.comparingInt((Entry e) -> e.job().priority()).thenComparingLong(Entry::sequence));
    private final Map<String, IngestionJob> jobs = new ConcurrentHashMap<>();
    private final Deque<String> finished = new ConcurrentLinkedDeque<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ReentrantLock runLock = new ReentrantLock();

    private volatile boolean accepting = true;
    private volatile boolean running;
    private volatile ExecutorService consumer;
    private volatile Future<?> consumerTask;
    private volatile IngestionJob activeJob;
    private volatile long lastStartMillis = -1;

    public SourceJobQueue(CaseSource source, long rateWindowMs, int retainedJobs, TaskScheduler retryScheduler,
                          Clock clock) {
        this.source = source;
        this.rateWindowMs = Math.max(0, rateWindowMs);
        this.retainedJobs = Math.max(1, retainedJobs);
        this.retryScheduler = retryScheduler;
        this.clock = clock;
    }

    public CaseSource source() {
        return source;
    }

    /**
     * @throws IllegalStateException once the queue has been stopped
     */
    public IngestionJob submit(FetchOptions options, JobTrigger trigger, int maxAttempts, long backoffMs) {
        if (!accepting) {
            throw new IllegalStateException("Queue for " + source.slug() + " is not accepting jobs");
        }
        IngestionJob job = new IngestionJob(UUID.randomUUID().toString(), source, options, trigger,
            maxAttempts, backoffMs, clock.instant());
        jobs.put(job.id(), job);
        waiting.offer(new Entry(job, sequence.incrementAndGet()));
        log.info("Queued {} job {} for {} (priority {})",
            trigger.name().toLowerCase(), job.id(), source.slug(), job.priority());
        return job;
    }

    /**
     * Cancel a job that has not started. Running and finished jobs are left
     * alone.
     *
     * @return true if the job was cancelled
     */
    public boolean cancel(String jobId) {
        IngestionJob job = jobs.get(jobId);
        if (job == null) return false;
        synchronized (job) {
            JobStatus status = job.status();
            if (status != JobStatus.WAITING && status != JobStatus.DELAYED) return false;
            waiting.removeIf(e -> e.job() == job);
            job.cancel(clock.instant());
        }
        retire(job);
        log.info("Cancelled job {} for {}", jobId, source.slug());
        return true;
    }

    public Optional<IngestionJob> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public int waitingCount() {
        return waiting.size();
    }

    public Optional<IngestionJob> activeJob() {
        return Optional.ofNullable(activeJob);
    }

    public boolean isRunning() {
        Future<?> task = consumerTask;
        return running && task != null && !task.isDone();
    }

    /**
     * Run {@code work} while holding this source's run lock, so it never
     * overlaps a queued job for the same source.
     */
    public <T> T runExclusive(Supplier<T> work) {
        runLock.lock();
        try {
            return work.get();
        } finally {
            runLock.unlock();
        }
    }

    public synchronized void start(JobHandler handler) {
        if (isRunning()) {
            throw new IllegalStateException("Queue for " + source.slug() + " is already running");
        }
        accepting = true;
        running = true;
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ingestion-worker-" + source.slug());
            t.setDaemon(true);
            return t;
        });
        consumer = executor;
        consumerTask = executor.submit(() -> consume(handler));
        // one consumer per start; the pool winds down once it returns
        executor.shutdown();
        log.info("Worker started for {}", source.slug());
    }

    /**
     * Stop intake and let the consumer finish its current job. Jobs still
     * waiting are cancelled.
     */
    public synchronized void stop() {
        accepting = false;
        running = false;
        List<Entry> drained = new ArrayList<>();
        waiting.drainTo(drained);
        for (Entry entry : drained) {
            cancelOnShutdown(entry.job());
        }
        if (!drained.isEmpty()) {
            log.warn("Cancelled {} waiting job(s) for {} on shutdown", drained.size(), source.slug());
        }
    }

    /**
     * @return true if the consumer has exited
     */
    public boolean awaitTermination(long timeoutMs) throws InterruptedException {
        ExecutorService executor = consumer;
        if (executor == null) return true;
        return executor.awaitTermination(Math.max(1, timeoutMs), TimeUnit.MILLISECONDS);
    }

    public void interrupt() {
        ExecutorService executor = consumer;
        if (executor != null && !executor.isTerminated()) {
            log.warn("Interrupting worker for {}", source.slug());
            executor.shutdownNow();
        }
    }

    private void consume(JobHandler handler) {
        while (running) {
            try {
                awaitRateWindow();
                Entry entry = waiting.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (entry != null && running) {
                    execute(entry.job(), handler);
                } else if (entry != null) {
                    cancelOnShutdown(entry.job());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("Worker stopped for {}", source.slug());
    }

    private void awaitRateWindow() throws InterruptedException {
        if (lastStartMillis < 0 || rateWindowMs == 0) return;
        long wait = lastStartMillis + rateWindowMs - clock.millis();
        while (wait > 0 && running) {
            Thread.sleep(Math.min(wait, POLL_INTERVAL_MS));
            wait = lastStartMillis + rateWindowMs - clock.millis();
        }
    }

    private void execute(IngestionJob job, JobHandler handler) {
        synchronized (job) {
            if (job.status() != JobStatus.WAITING) return;
            job.markActive();
        }
        activeJob = job;
        lastStartMillis = clock.millis();
        log.info("Starting job {} for {} (attempt {}/{})", job.id(), source.slug(), job.attempts(), job.maxAttempts());

        runLock.lock();
        try {
            IngestionResult result = handler.handle(job);
            job.complete(result, clock.instant());
            retire(job);
            log.info("Job {} for {} completed", job.id(), source.slug());
        } catch (RuntimeException e) {
            onFailure(job, e);
        } catch (Throwable e) {
            // not retried; the consumer keeps serving the queue
            job.fail(e, clock.instant());
            retire(job);
            log.error("Job {} for {} aborted on attempt {}", job.id(), source.slug(), job.attempts(), e);
        } finally {
            runLock.unlock();
            activeJob = null;
        }
    }

    private void onFailure(IngestionJob job, RuntimeException error) {
        if (job.hasAttemptsLeft() && accepting) {
            long delay = job.nextBackoffMs();
            job.markDelayed(error.getMessage());
            log.warn("Job {} for {} failed (attempt {}/{}), retrying in {} ms: {}",
                job.id(), source.slug(), job.attempts(), job.maxAttempts(), delay, error.getMessage());
            if (delay <= 0) {
                requeue(job);
            } else {
                retryScheduler.schedule(() -> requeue(job), clock.instant().plusMillis(delay));
            }
        } else {
            job.fail(error, clock.instant());
            retire(job);
            log.error("Job {} for {} failed after {} attempt(s)", job.id(), source.slug(), job.attempts(), error);
        }
    }

    private void requeue(IngestionJob job) {
        synchronized (job) {
            if (job.status() != JobStatus.DELAYED) return;
            if (!accepting) {
                job.cancel(clock.instant());
            } else {
                job.markWaiting();
                waiting.offer(new Entry(job, sequence.incrementAndGet()));
                return;
            }
        }
        retire(job);
    }

    private void cancelOnShutdown(IngestionJob job) {
        synchronized (job) {
            if (job.status().isTerminal()) return;
            job.cancel(clock.instant());
        }
        retire(job);
    }

    private void retire(IngestionJob job) {
        finished.add(job.id());
        while (finished.size() > retainedJobs) {
            String oldest = finished.poll();
            if (oldest != null) jobs.remove(oldest);
        }
    }
}
