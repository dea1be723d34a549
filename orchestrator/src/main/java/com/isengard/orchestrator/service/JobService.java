package com.isengard.orchestrator.service;

import com.isengard.orchestrator.events.EventBus;
import com.isengard.orchestrator.events.ProgressEvent;
import com.isengard.orchestrator.model.Job;
import com.isengard.orchestrator.model.JobConfig;
import com.isengard.orchestrator.model.JobKind;
import com.isengard.orchestrator.model.JobStatus;
import com.isengard.orchestrator.queue.JobQueue;
import com.isengard.orchestrator.validation.ConfigValidator;
import com.isengard.orchestrator.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.UUID;

/**
 * What the API can do with jobs: submit, read, list, cancel.
 *
 * Submission validates before anything is stored, so a rejected config
 * never reaches the queue or a worker slot. Reads go straight to the
 * JobStore; there is no cached "current job", the ongoing group of
 * {@link #list} answers that question.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final ConfigValidator validator;
    private final JobStore        store;
    private final JobQueue        queue;
    private final EventBus        bus;
    private final WorkerPool      workers;

    public JobService(ConfigValidator validator,
                      JobStore store,
                      JobQueue queue,
                      EventBus bus,
                      WorkerPool workers) {
        this.validator = validator;
        this.store     = store;
        this.queue     = queue;
        this.bus       = bus;
        this.workers   = workers;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Validate, store as PENDING, enqueue. The row and its queue entry commit
     * together or not at all.
     *
     * @throws com.isengard.orchestrator.validation.ValidationException if the config is rejected
     */
    @Transactional
    public Job submit(JobKind kind, Map<String, Object> config) {
        JobConfig snapshot = validator.validate(kind, config);
        int totalSteps = kind == JobKind.TRAINING
                ? snapshot.intValue("steps", 1000)
                : snapshot.intValue("count", 1);

        Job job = store.create(kind, snapshot, totalSteps);
        queue.enqueue(job.getId());
        log.info("Submitted {} job {}", kind, job.getId());
        return job;
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public Job get(UUID id) {
        return store.get(id);
    }

    public Page<Job> list(JobFilter filter) {
        return store.list(filter);
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Idempotent cancel.
     *
     * A job a worker holds is stopped by that worker (graceful, then forced).
     * A job nobody holds yet is cancelled here directly and its queue entry
     * dropped; a later dequeue of it would be a no-op anyway.
     *
     * @throws JobNotFoundException if the job does not exist
     */
    public CancelOutcome cancel(UUID id) {
        Job job = store.get(id);
        if (job.isTerminal()) {
            return CancelOutcome.ALREADY_TERMINAL;
        }
        if (workers.cancel(id)) {
            return CancelOutcome.CANCELLING;
        }
        try {
            store.updateStatus(id, JobStatus.CANCELLED);
        } catch (InvalidTransitionException e) {
            // a worker took the job or it finished between the read and the write
            if (workers.cancel(id)) return CancelOutcome.CANCELLING;
            if (store.get(id).isTerminal()) return CancelOutcome.ALREADY_TERMINAL;
            throw e;
        }

        bus.open(id, job.getLastSequence());
        ProgressEvent done = bus.publish(id, ProgressEvent.complete(id, JobStatus.CANCELLED, null, null,
                "Job cancelled before it started"));
        store.recordSequence(id, done.sequence());
        queue.ack(id);
        log.info("Cancelled job {} from {}", id, job.getStatus());
        return CancelOutcome.CANCELLED;
    }
}
