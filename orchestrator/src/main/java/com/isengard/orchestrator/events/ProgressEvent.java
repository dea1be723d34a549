package com.isengard.orchestrator.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.isengard.orchestrator.model.JobError;
import com.isengard.orchestrator.model.JobStatus;
import com.isengard.orchestrator.model.ProgressSource;
import com.isengard.orchestrator.progress.ProgressSnapshot;

import java.time.Instant;
import java.util.UUID;

/**
 * One event on a job's stream.
 *
 * {@code sequence} is assigned by the event bus at publish time and increases
 * by one per job; it is the ordering authority, the SSE id, and the resume
 * token a reconnecting client sends back. Drafts carry sequence 0.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProgressEvent(
        UUID           jobId,
        long           sequence,
        Instant        timestamp,
        EventType      type,
        String         status,
        String         stage,
        Integer        step,
        Integer        stepsTotal,
        Double         percent,
        Double         loss,
        Double         lr,
        Long           etaSeconds,
        Double         iterationSpeed,
        ProgressSource source,
        String         message,
        GpuMetrics     gpu,
        ArtifactRef    sampleArtifact,
        String         errorType,
        String         errorMessage
) {

    /** Copy of this draft stamped with its bus-assigned sequence and time. */
    public ProgressEvent stamped(long seq, Instant at) {
        return new ProgressEvent(jobId, seq, at, type, status, stage, step, stepsTotal, percent, loss, lr,
                etaSeconds, iterationSpeed, source, message, gpu, sampleArtifact, errorType, errorMessage);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return type == EventType.COMPLETE;
    }

    // ------------------------------------------------------------------
    // Draft factories
    // ------------------------------------------------------------------

    public static ProgressEvent status(UUID jobId, JobStatus status, String stage, String message) {
        return new ProgressEvent(jobId, 0, null, EventType.STATUS, status.wireName(), stage,
                null, null, null, null, null, null, null, null, message, null, null, null, null);
    }

    public static ProgressEvent progress(UUID jobId, String stage, ProgressSnapshot p,
                                         GpuMetrics gpu, String message) {
        return new ProgressEvent(jobId, 0, null, EventType.PROGRESS, JobStatus.RUNNING.wireName(), stage,
                p.currentStep(), p.totalSteps(), p.percent(), p.loss(), p.learningRate(), p.etaSeconds(),
                p.iterationSpeed(), p.source(), message, gpu, null, null, null);
    }

    public static ProgressEvent log(UUID jobId, String line) {
        return new ProgressEvent(jobId, 0, null, EventType.LOG, null, null,
                null, null, null, null, null, null, null, null, line, null, null, null, null);
    }

    public static ProgressEvent artifact(UUID jobId, ArtifactRef artifact) {
        return new ProgressEvent(jobId, 0, null, EventType.ARTIFACT, null, null,
                artifact.step(), null, null, null, null, null, null, null,
                "New " + artifact.kind().name().toLowerCase() + ": " + artifact.name(),
                null, artifact, null, null);
    }

    public static ProgressEvent complete(UUID jobId, JobStatus status, ProgressSnapshot p,
                                         JobError error, String message) {
        return new ProgressEvent(jobId, 0, null, EventType.COMPLETE, status.wireName(), status.wireName(),
                p == null ? null : p.currentStep(), p == null ? null : p.totalSteps(),
                p == null ? null : p.percent(), p == null ? null : p.loss(), null, null, null,
                p == null ? null : p.source(), message, null, null,
                error == null ? null : error.type(), error == null ? null : error.message());
    }
}
