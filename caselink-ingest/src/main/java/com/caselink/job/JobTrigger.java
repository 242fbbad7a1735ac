package com.caselink.job;

/**
 * Where a job came from. Lower priority values run first.
 */
public enum JobTrigger {
    MANUAL(1),
    SCHEDULED(10);

    private final int priority;

    JobTrigger(int priority) {
        this.priority = priority;
    }

    public int priority() {
        return priority;
    }
}
