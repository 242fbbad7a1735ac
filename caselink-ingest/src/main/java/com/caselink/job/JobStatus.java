package com.caselink.job;

public enum JobStatus {
    WAITING,
    /** Failed, waiting out its backoff before the next attempt. */
    DELAYED,
    ACTIVE,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
