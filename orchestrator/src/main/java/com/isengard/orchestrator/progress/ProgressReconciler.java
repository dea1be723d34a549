package com.isengard.orchestrator.progress;

import com.isengard.orchestrator.model.ProgressSource;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Merges the engine's two progress signals into one value for a single job.
 *
 * <ul>
 *   <li>A STRUCTURED reading is taken whenever it is not behind the current step.</li>
 *   <li>A LOG_STEP reading is only taken when no structured reading arrived
 *       within the staleness window.</li>
 *   <li>Progress never moves backwards: a reading with a lower step than the
 *       current one is a stale duplicate and is dropped silently.</li>
 * </ul>
 *
 * ETA is {@code elapsed / done * (total - current)}, where {@code done}
 * counts only the steps this instance has seen, not those of an earlier
 * delivery it was resumed from. Iteration speed is an
 * exponential moving average of step deltas; steps that arrive in the same
 * instant (a flushed log buffer) are pooled into the next sample instead of
 * producing a spike.
 *
 * One instance per job; only the job's reader thread calls {@link #accept}.
 */
public class ProgressReconciler {

    private final Duration stalenessWindow;
    private final double   smoothing;
    private final Clock    clock;
    private final Instant  startedAt;

    private ProgressSnapshot current;
    private Instant lastStructuredAt;
    private int     resumedFrom;

    // Speed sampling state.
    private Instant lastSpeedSampleAt;
    private int     pendingStepDelta;
    private Double  smoothedSpeed;

    public ProgressReconciler(int totalSteps,
                              Duration stalenessWindow,
                              double smoothing,
                              Clock clock) {
        this.stalenessWindow   = stalenessWindow;
        this.smoothing         = smoothing;
        this.clock             = clock;
        this.startedAt         = clock.instant();
        this.lastSpeedSampleAt = startedAt;
        this.current           = ProgressSnapshot.initial(totalSteps);
    }

    /**
     * Start from a step already reached by an earlier delivery of the same
     * job, so readings from a restarted engine cannot move progress back.
     */
    public void resumeAt(int step, ProgressSource source) {
        if (step <= current.currentStep()) return;
        resumedFrom = step;
        int total = current.totalSteps();
        double percent = total > 0 ? Math.min(100.0, round2(step * 100.0 / total)) : 0.0;
        current = new ProgressSnapshot(step, total, percent, null, null, null, null, source);
    }

    public ProgressSnapshot current() {
        return current;
    }

    /**
     * Feed one parsed line.
     *
     * @return the new snapshot if the line changed progress, empty otherwise
     */
    public Optional<ProgressSnapshot> accept(EngineLine line) {
        Instant now = clock.instant();
        return switch (line.kind()) {
            case STRUCTURED -> acceptStructured(line, now);
            case LOG_STEP   -> acceptLogDerived(line, now);
            case TEXT       -> Optional.empty();
        };
    }

    private Optional<ProgressSnapshot> acceptStructured(EngineLine line, Instant now) {
        if (!line.hasStep()) {
            if (line.loss() == null) return Optional.empty();
            // loss-only record: refresh the loss, keep everything else
            current = new ProgressSnapshot(current.currentStep(), current.totalSteps(), current.percent(),
                    line.loss(), firstNonNull(line.learningRate(), current.learningRate()),
                    current.iterationSpeed(), current.etaSeconds(), current.source());
            return Optional.of(current);
        }
        lastStructuredAt = now;
        if (line.step() < current.currentStep()) return Optional.empty();
        return Optional.of(apply(line, ProgressSource.STRUCTURED, now));
    }

    private Optional<ProgressSnapshot> acceptLogDerived(EngineLine line, Instant now) {
        if (structuredIsFresh(now)) return Optional.empty();
        if (line.step() < current.currentStep()) return Optional.empty();
        return Optional.of(apply(line, ProgressSource.LOG_DERIVED, now));
    }

    private boolean structuredIsFresh(Instant now) {
        return lastStructuredAt != null
                && Duration.between(lastStructuredAt, now).compareTo(stalenessWindow) < 0;
    }

    private ProgressSnapshot apply(EngineLine line, ProgressSource source, Instant now) {
        int step  = line.step();
        int total = line.totalSteps() != null && line.totalSteps() > 0
                ? line.totalSteps()
                : current.totalSteps();

        updateSpeed(step - current.currentStep(), now);

        double percent = total > 0 ? Math.min(100.0, round2(step * 100.0 / total)) : 0.0;
        Long   eta     = eta(step, total, now);

        current = new ProgressSnapshot(
                step,
                total,
                percent,
                firstNonNull(line.loss(), current.loss()),
                firstNonNull(line.learningRate(), current.learningRate()),
                smoothedSpeed == null ? null : round2(smoothedSpeed),
                eta,
                source);
        return current;
    }

    private void updateSpeed(int stepDelta, Instant now) {
        if (stepDelta <= 0) return;
        pendingStepDelta += stepDelta;
        double seconds = Duration.between(lastSpeedSampleAt, now).toNanos() / 1e9;
        if (seconds <= 0) return;   // same instant as the previous sample: pool it
        double rate = pendingStepDelta / seconds;
        smoothedSpeed = smoothedSpeed == null ? rate : smoothing * rate + (1 - smoothing) * smoothedSpeed;
        pendingStepDelta  = 0;
        lastSpeedSampleAt = now;
    }

    private Long eta(int step, int total, Instant now) {
        int done = step - resumedFrom;
        if (done <= 0 || total <= 0) return null;
        double elapsed = Duration.between(startedAt, now).toNanos() / 1e9;
        return Math.round(elapsed / done * Math.max(0, total - step));
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }

    private static <T> T firstNonNull(T a, T b) {
        return a != null ? a : b;
    }
}
