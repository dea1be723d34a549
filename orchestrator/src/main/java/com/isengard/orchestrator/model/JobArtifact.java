package com.isengard.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One output produced by a job: a training sample image, an intermediate
 * checkpoint, the final LoRA, or a generated image.
 *
 * (job_id, path) is unique, so re-running a redelivered job never records
 * the same file twice.
 *
 * DB table: job_artifacts  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "job_artifacts",
       uniqueConstraints = @UniqueConstraint(columnNames = {"job_id", "path"}))
public class JobArtifact {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false)
    private Job job;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String path;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ArtifactKind kind;

    // Training step the artifact was produced at, when known.
    @Column
    private Integer step;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected JobArtifact() {}   // required by JPA

    private JobArtifact(Job job, String name, String path, ArtifactKind kind, Integer step, Instant createdAt) {
        this.job       = job;
        this.name      = name;
        this.path      = path;
        this.kind      = kind;
        this.step      = step;
        this.createdAt = createdAt;
    }

    /** Create an artifact and attach it to the job's ordered list. */
    public static JobArtifact attach(Job job, String name, String path, ArtifactKind kind, Integer step,
                                     Instant createdAt) {
        JobArtifact artifact = new JobArtifact(job, name, path, kind, step, createdAt);
        job.addArtifact(artifact);
        return artifact;
    }

    public UUID         getId()        { return id; }
    public Job          getJob()       { return job; }
    public String       getName()      { return name; }
    public String       getPath()      { return path; }
    public ArtifactKind getKind()      { return kind; }
    public Integer      getStep()      { return step; }
    public Instant      getCreatedAt() { return createdAt; }
}
