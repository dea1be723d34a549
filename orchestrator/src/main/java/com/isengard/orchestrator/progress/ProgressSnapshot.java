package com.isengard.orchestrator.progress;

import com.isengard.orchestrator.model.JobProgress;
import com.isengard.orchestrator.model.ProgressSource;

/**
 * The reconciled, authoritative progress of a running job at one instant.
 */
public record ProgressSnapshot(
        int            currentStep,
        int            totalSteps,
        double         percent,
        Double         loss,
        Double         learningRate,
        Double         iterationSpeed,
        Long           etaSeconds,
        ProgressSource source
) {

    public static ProgressSnapshot initial(int totalSteps) {
        return new ProgressSnapshot(0, totalSteps, 0.0, null, null, null, null, null);
    }

    /** The same reading pinned to 100%, as reported when a job completes. */
    public ProgressSnapshot finished() {
        int step = totalSteps > 0 ? Math.max(currentStep, totalSteps) : currentStep;
        return new ProgressSnapshot(step, totalSteps, 100.0, loss, learningRate, iterationSpeed, 0L, source);
    }

    public JobProgress toJobProgress() {
        return new JobProgress(currentStep, totalSteps, percent, loss, iterationSpeed, etaSeconds, source);
    }
}
