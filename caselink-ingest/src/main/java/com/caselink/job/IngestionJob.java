package com.caselink.job;

import com.caselink.model.CaseSource;
import com.caselink.model.FetchOptions;
import com.caselink.model.IngestionResult;

import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * A queued ingestion run. State changes are made by the owning
 * {@link SourceJobQueue} only; everyone else reads snapshots or waits on
 * {@link #completion()}.
 */
public class IngestionJob {

    private final String id;
    private final CaseSource source;
    private final FetchOptions options;
    private final JobTrigger trigger;
    private final int maxAttempts;
    private final long backoffMs;
    private final Instant createdAt;
    private final CompletableFuture<IngestionResult> completion = new CompletableFuture<>();

    private volatile JobStatus status = JobStatus.WAITING;
    private volatile int attempts;
    private volatile String lastError;
    private volatile IngestionResult result;
    private volatile Instant finishedAt;

    IngestionJob(String id, CaseSource source, FetchOptions options, JobTrigger trigger, int maxAttempts,
                 long backoffMs, Instant createdAt) {
        this.id = id;
        this.source = source;
        this.options = options != null ? options : FetchOptions.defaults();
        this.trigger = trigger;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = Math.max(0, backoffMs);
        this.createdAt = createdAt;
    }

    public String id() { return id; }
    public CaseSource source() { return source; }
    public FetchOptions options() { return options; }
    public JobTrigger trigger() { return trigger; }
    public int priority() { return trigger.priority(); }
    public int maxAttempts() { return maxAttempts; }
    public JobStatus status() { return status; }
    public int attempts() { return attempts; }

    public CompletableFuture<IngestionResult> completion() {
        return completion;
    }

    /** Delay before the next attempt: backoff * 2^(attempts - 1). */
    long nextBackoffMs() {
        return backoffMs * (1L << Math.min(Math.max(attempts - 1, 0), 20));
    }

    boolean hasAttemptsLeft() {
        return attempts < maxAttempts;
    }

    void markActive() {
        attempts++;
        status = JobStatus.ACTIVE;
    }

    void markDelayed(String error) {
        lastError = error;
        status = JobStatus.DELAYED;
    }

    void markWaiting() {
        status = JobStatus.WAITING;
    }

    void complete(IngestionResult result, Instant at) {
        this.result = result;
        this.finishedAt = at;
        this.status = JobStatus.COMPLETED;
        completion.complete(result);
    }

    void fail(Throwable error, Instant at) {
        this.lastError = error.getMessage();
        this.finishedAt = at;
        this.status = JobStatus.FAILED;
        completion.completeExceptionally(error);
    }

    void cancel(Instant at) {
        this.finishedAt = at;
        this.status = JobStatus.CANCELLED;
        completion.completeExceptionally(new CancellationException("Job " + id + " cancelled"));
    }

    public JobSnapshot snapshot() {
        return new JobSnapshot(id, source.slug(), trigger, priority(), status, attempts, maxAttempts,
            createdAt, finishedAt, lastError, result);
    }
}
