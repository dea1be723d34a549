package com.isengard.orchestrator.service;

import com.isengard.orchestrator.model.*;
import com.isengard.orchestrator.repository.JobArtifactRepository;
import com.isengard.orchestrator.repository.JobRepository;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of every job: identity, status, config, progress, artifacts.
 *
 * All mutations load the row with a pessimistic lock inside one transaction,
 * so a concurrent reader sees either the old job or the new one, never a mix.
 * Locks are per row: two workers updating different jobs never wait on each other.
 */
@Service
public class JobStore {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);

    private final JobRepository         jobRepo;
    private final JobArtifactRepository artifactRepo;
    private final MeterRegistry         meterRegistry;
    private final Clock                 clock;

    public JobStore(JobRepository jobRepo,
                    JobArtifactRepository artifactRepo,
                    MeterRegistry meterRegistry,
                    Clock clock) {
        this.jobRepo       = jobRepo;
        this.artifactRepo  = artifactRepo;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Creation and reads
    // ------------------------------------------------------------------

    /**
     * Persist a new job in PENDING with its immutable config snapshot.
     *
     * @param totalSteps initial progress.total_steps (training steps, or image count)
     */
    @Transactional
    public Job create(JobKind kind, JobConfig config, int totalSteps) {
        Job job = new Job(kind, config, clock.instant());
        job.getProgress().setTotalSteps(totalSteps);
        Job saved = jobRepo.save(job);
        log.info("Created {} job {} (total_steps={})", kind, saved.getId(), totalSteps);
        meterRegistry.counter("isengard.jobs.transitions", "status", JobStatus.PENDING.wireName()).increment();
        return saved;
    }

    /** Full snapshot of one job, artifacts included. */
    @Transactional(readOnly = true)
    public Job get(UUID id) {
        return jobRepo.findWithArtifactsById(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public Optional<Job> find(UUID id) {
        return jobRepo.findById(id);
    }

    /** Filtered list, newest first. */
    @Transactional(readOnly = true)
    public Page<Job> list(JobFilter filter) {
        PageRequest page = PageRequest.of(filter.page(), filter.size(),
                Sort.by(Sort.Direction.DESC, "createdAt"));
        if (filter.kind() == null) {
            return jobRepo.findByStatusIn(filter.group().statuses(), page);
        }
        return jobRepo.findByKindAndStatusIn(filter.kind(), filter.group().statuses(), page);
    }

    // ------------------------------------------------------------------
    // Mutations
    // ------------------------------------------------------------------

    /**
     * Move a job to {@code next}.
     *
     * Timestamps follow the status: started_at is set on the first RUNNING,
     * completed_at on any terminal status. {@code error} is recorded only
     * for FAILED.
     *
     * @throws InvalidTransitionException if the edge is not in the lifecycle;
     *         the job is left unchanged. This is what turns a duplicate
     *         terminal event from a flaky engine into a no-op.
     */
    @Transactional
    public Job updateStatus(UUID id, JobStatus next, JobError error) {
        Job job = lockJob(id);
        JobStatus current = job.getStatus();
        if (!current.canTransitionTo(next)) {
            log.error("Rejected illegal transition for job {}: {} -> {}", id, current, next);
            throw new InvalidTransitionException(id, current, next);
        }

        Instant now = clock.instant();
        job.setStatus(next);
        if (next == JobStatus.RUNNING && job.getStartedAt() == null) {
            job.setStartedAt(now);
        }
        if (next.isTerminal()) {
            job.setCompletedAt(now);
        }
        if (next == JobStatus.COMPLETED) {
            job.getProgress().markFinished();
        }
        if (next == JobStatus.FAILED) {
            JobError e = error != null ? error : JobError.runtime("Job failed");
            job.setError(e.type(), e.message());
        }

        Job saved = jobRepo.save(job);
        log.info("Job {} {} -> {}", id, current, next);
        meterRegistry.counter("isengard.jobs.transitions", "status", next.wireName()).increment();
        return saved;
    }

    @Transactional
    public Job updateStatus(UUID id, JobStatus next) {
        return updateStatus(id, next, null);
    }

    /** Record that the queue handed this job to a worker again. */
    @Transactional
    public Job recordDelivery(UUID id, int deliveries) {
        Job job = lockJob(id);
        job.setDeliveries(deliveries);
        return jobRepo.save(job);
    }

    /**
     * Persist the cheap progress fields and the latest event sequence.
     *
     * Ignored unless the job is RUNNING. The stored step never decreases,
     * even if a late write carries an older reading.
     *
     * @return true if the write was applied
     */
    @Transactional
    public boolean updateProgress(UUID id, JobProgress progress, long lastSequence) {
        Job job = lockJob(id);
        if (job.getStatus() != JobStatus.RUNNING) {
            log.debug("Dropping progress write for job {} in status {}", id, job.getStatus());
            return false;
        }
        job.getProgress().mergeFrom(progress);
        job.advanceLastSequence(lastSequence);
        jobRepo.save(job);
        return true;
    }

    /** Advance the stored event sequence without touching progress. */
    @Transactional
    public void recordSequence(UUID id, long lastSequence) {
        Job job = lockJob(id);
        if (lastSequence > job.getLastSequence()) {
            job.advanceLastSequence(lastSequence);
            jobRepo.save(job);
        }
    }

    /**
     * Append an artifact to the job's ordered list.
     *
     * Idempotent on path: re-recording a file that is already listed (for
     * instance after a crashed worker's job is redelivered) is a no-op.
     * Terminal jobs are immutable, so appends to them are refused.
     *
     * @return true if a new artifact was recorded
     */
    @Transactional
    public boolean appendArtifact(UUID id, ArtifactDraft draft) {
        Job job = lockJob(id);
        if (job.isTerminal()) {
            log.warn("Refusing artifact {} for terminal job {} ({})", draft.path(), id, job.getStatus());
            return false;
        }
        if (artifactRepo.existsByJobIdAndPath(id, draft.path())) {
            return false;
        }
        JobArtifact artifact = JobArtifact.attach(job, draft.name(), draft.path(), draft.kind(), draft.step(),
                clock.instant());
        artifactRepo.save(artifact);
        log.info("Job {} recorded {} artifact {}", id, draft.kind(), draft.path());
        return true;
    }

    @Transactional(readOnly = true)
    public List<JobArtifact> artifacts(UUID id) {
        if (!jobRepo.existsById(id)) throw new JobNotFoundException(id);
        return artifactRepo.findByJobIdOrderByCreatedAtAsc(id);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Lock the row for a mutation and stamp updated_at. */
    private Job lockJob(UUID id) {
        Job job = jobRepo.findByIdForUpdate(id).orElseThrow(() -> new JobNotFoundException(id));
        job.touch(clock.instant());
        return job;
    }
}
