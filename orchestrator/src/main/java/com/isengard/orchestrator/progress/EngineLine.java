package com.isengard.orchestrator.progress;

import com.isengard.orchestrator.events.GpuMetrics;

/**
 * One line of engine output after parsing.
 *
 * STRUCTURED lines come from the engine's JSON progress feed, LOG_STEP lines
 * are free text that matched a step pattern, TEXT is everything else.
 */
public record EngineLine(
        Kind       kind,
        String     raw,
        Integer    step,
        Integer    totalSteps,
        Double     loss,
        Double     learningRate,
        String     message,
        GpuMetrics gpu,
        String     samplePath,
        String     checkpointPath
) {

    public enum Kind { STRUCTURED, LOG_STEP, TEXT }

    public static EngineLine text(String raw) {
        return new EngineLine(Kind.TEXT, raw, null, null, null, null, raw, null, null, null);
    }

    public static EngineLine logStep(String raw, int step, int total, Double loss, Double lr) {
        return new EngineLine(Kind.LOG_STEP, raw, step, total, loss, lr, raw, null, null, null);
    }

    public boolean hasStep() {
        return step != null;
    }

    public boolean hasArtifact() {
        return samplePath != null || checkpointPath != null;
    }
}
