package com.isengard.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * One unit of work: a LoRA training run or an image generation run.
 *
 * Created by the API in PENDING, mutated only by the worker that owns it
 * while non-terminal, and read-only once COMPLETED / FAILED / CANCELLED.
 * JobStore is the only component that writes this entity.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private JobKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    // Snapshot of submitted parameters; the column is never updated.
    @Convert(converter = JobConfigConverter.class)
    @Column(name = "config_json", nullable = false, updatable = false, columnDefinition = "TEXT")
    private JobConfig config;

    @Embedded
    private JobProgress progress = new JobProgress();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // Set only when status = FAILED.
    @Column(name = "error_type")
    private String errorType;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // Highest event sequence published for this job; seeds the event bus
    // after a restart so sequences keep increasing.
    @Column(name = "last_sequence", nullable = false)
    private long lastSequence = 0;

    // How many times the queue has handed this job to a worker.
    @Column(nullable = false)
    private int deliveries = 0;

    @OneToMany(mappedBy = "job", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("createdAt ASC, id ASC")
    private List<JobArtifact> artifacts = new ArrayList<>();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(JobKind kind, JobConfig config, Instant createdAt) {
        this.kind      = kind;
        this.config    = config;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID        getId()           { return id; }
    public JobKind     getKind()         { return kind; }
    public JobStatus   getStatus()       { return status; }
    public JobConfig   getConfig()       { return config; }
    public JobProgress getProgress()     { return progress; }
    public Instant     getCreatedAt()    { return createdAt; }
    public Instant     getStartedAt()    { return startedAt; }
    public Instant     getCompletedAt()  { return completedAt; }
    public Instant     getUpdatedAt()    { return updatedAt; }
    public String      getErrorType()    { return errorType; }
    public String      getErrorMessage() { return errorMessage; }
    public long        getLastSequence() { return lastSequence; }
    public int         getDeliveries()   { return deliveries; }

    public List<JobArtifact> getArtifacts() {
        return Collections.unmodifiableList(artifacts);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public void setStatus(JobStatus status)            { this.status = status; }
    public void setStartedAt(Instant t)                { this.startedAt = t; }
    public void setCompletedAt(Instant t)              { this.completedAt = t; }
    public void setDeliveries(int deliveries)          { this.deliveries = deliveries; }
    public void touch(Instant now)                     { this.updatedAt = now; }

    public void setError(String type, String message) {
        this.errorType    = type;
        this.errorMessage = message;
    }

    public void advanceLastSequence(long sequence) {
        this.lastSequence = Math.max(this.lastSequence, sequence);
    }

    /** Package-private: artifacts are appended through JobStore only. */
    void addArtifact(JobArtifact artifact) {
        artifacts.add(artifact);
    }
}
