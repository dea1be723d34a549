package com.isengard.orchestrator.events;

/**
 * GPU telemetry relayed from the engine. Display only; it never drives
 * a status change.
 */
public record GpuMetrics(
        Double utilizationPct,
        Double memoryUsedGb,
        Double memoryTotalGb,
        Double temperatureC,
        Double powerWatts
) {}
