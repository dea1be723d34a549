package com.isengard.orchestrator.service;

import java.util.UUID;

/**
 * Thrown when a job id does not exist in the store.
 */
public class JobNotFoundException extends RuntimeException {

    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public UUID getJobId() { return jobId; }
}
