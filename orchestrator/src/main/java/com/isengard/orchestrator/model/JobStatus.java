package com.isengard.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a Job.
 *
 * Transitions:
 *   PENDING  → QUEUED     (dequeued by a worker)
 *   QUEUED   → RUNNING    (engine subprocess launched)
 *   QUEUED   → FAILED     (LaunchError: the subprocess never started)
 *   RUNNING  → COMPLETED  (exit 0 and every expected artifact present)
 *   RUNNING  → FAILED     (non-zero exit, missing artifact, or WorkerCrash)
 *   RUNNING  → CANCELLED
 *   PENDING/QUEUED → CANCELLED (cancelled before launch)
 *
 * COMPLETED, FAILED and CANCELLED are terminal; nothing leaves them.
 */
public enum JobStatus {
    PENDING,
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return allowedNext().contains(next);
    }

    public Set<JobStatus> allowedNext() {
        return switch (this) {
            case PENDING   -> EnumSet.of(QUEUED, CANCELLED);
            case QUEUED    -> EnumSet.of(RUNNING, FAILED, CANCELLED);
            case RUNNING   -> EnumSet.of(COMPLETED, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(JobStatus.class);
        };
    }

    /** Lower-case name used on the wire ("running", "completed", ...). */
    public String wireName() {
        return name().toLowerCase();
    }
}
