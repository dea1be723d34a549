package com.isengard.orchestrator.service;

import com.isengard.orchestrator.model.JobStatus;

import java.util.UUID;

/**
 * Thrown when a status change does not follow the lifecycle edges in
 * {@link JobStatus}. The job is left exactly as it was.
 */
public class InvalidTransitionException extends RuntimeException {

    private final UUID      jobId;
    private final JobStatus from;
    private final JobStatus to;

    public InvalidTransitionException(UUID jobId, JobStatus from, JobStatus to) {
        super("Illegal transition for job " + jobId + ": " + from + " -> " + to);
        this.jobId = jobId;
        this.from  = from;
        this.to    = to;
    }

    public UUID      getJobId() { return jobId; }
    public JobStatus getFrom()  { return from; }
    public JobStatus getTo()    { return to; }
}
