package com.isengard.orchestrator.stream;

import com.isengard.orchestrator.events.EventType;
import com.isengard.orchestrator.events.ProgressEvent;
import com.isengard.orchestrator.model.Job;
import com.isengard.orchestrator.model.JobProgress;

import java.time.Instant;

/**
 * Builds the full-state event a stream opens with (or falls back to when a
 * reconnect gap is wider than the backlog).
 */
final class SnapshotEvents {

    private SnapshotEvents() {}

    /**
     * A SNAPSHOT event for a live job, or a COMPLETE event carrying the final
     * state for a terminal one.
     */
    static ProgressEvent of(Job job, long sequence, Instant now) {
        JobProgress p = job.getProgress();
        EventType type = job.isTerminal() ? EventType.COMPLETE : EventType.SNAPSHOT;
        return new ProgressEvent(
                job.getId(),
                sequence,
                now,
                type,
                job.getStatus().wireName(),
                job.getStatus().wireName(),
                p.getCurrentStep(),
                p.getTotalSteps(),
                p.getPercent(),
                p.getLoss(),
                null,
                p.getEtaSeconds(),
                p.getIterationSpeed(),
                p.getSource(),
                job.isTerminal() ? "Job " + job.getStatus().wireName() : "Connected to progress stream",
                null,
                null,
                job.getErrorType(),
                job.getErrorMessage());
    }
}
