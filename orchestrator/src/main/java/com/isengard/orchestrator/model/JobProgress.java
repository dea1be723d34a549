package com.isengard.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;

/**
 * The mutable progress block of a Job.
 *
 * Only the cheap-to-write fields live here; the worker persists them on a
 * coalescing interval, not on every engine output line.
 */
@Embeddable
public class JobProgress {

    @Column(name = "current_step", nullable = false)
    private int currentStep = 0;

    @Column(name = "total_steps", nullable = false)
    private int totalSteps = 0;

    @Column(name = "percent", nullable = false)
    private double percent = 0.0;

    @Column(name = "loss")
    private Double loss;

    @Column(name = "iteration_speed")
    private Double iterationSpeed;

    @Column(name = "eta_seconds")
    private Long etaSeconds;

    @Enumerated(EnumType.STRING)
    @Column(name = "progress_source")
    private ProgressSource source;

    public JobProgress() {}

    public JobProgress(int currentStep, int totalSteps, double percent, Double loss,
                       Double iterationSpeed, Long etaSeconds, ProgressSource source) {
        this.currentStep    = currentStep;
        this.totalSteps     = totalSteps;
        this.percent        = percent;
        this.loss           = loss;
        this.iterationSpeed = iterationSpeed;
        this.etaSeconds     = etaSeconds;
        this.source         = source;
    }

    public int            getCurrentStep()    { return currentStep; }
    public int            getTotalSteps()     { return totalSteps; }
    public double         getPercent()        { return percent; }
    public Double         getLoss()           { return loss; }
    public Double         getIterationSpeed() { return iterationSpeed; }
    public Long           getEtaSeconds()     { return etaSeconds; }
    public ProgressSource getSource()         { return source; }

    public void setTotalSteps(int totalSteps) { this.totalSteps = totalSteps; }

    /**
     * Merge a newer reading into this block. The step never moves backwards;
     * a lower step is ignored while the other fields still refresh.
     */
    public void mergeFrom(JobProgress newer) {
        if (newer.currentStep >= this.currentStep) {
            this.currentStep = newer.currentStep;
            this.percent     = newer.percent;
        }
        if (newer.totalSteps > 0)          this.totalSteps     = newer.totalSteps;
        if (newer.loss != null)            this.loss           = newer.loss;
        if (newer.iterationSpeed != null)  this.iterationSpeed = newer.iterationSpeed;
        if (newer.etaSeconds != null)      this.etaSeconds     = newer.etaSeconds;
        if (newer.source != null)          this.source         = newer.source;
    }

    /** Pin the block to 100% when a job completes. */
    public void markFinished() {
        if (totalSteps > 0) this.currentStep = Math.max(currentStep, totalSteps);
        this.percent    = 100.0;
        this.etaSeconds = 0L;
    }
}
