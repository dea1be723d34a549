package com.isengard.orchestrator.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.isengard.orchestrator.model.JobProgress;
import com.isengard.orchestrator.model.ProgressSource;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProgressResponse(
        int            currentStep,
        int            totalSteps,
        double         percent,
        Double         loss,
        Double         iterationSpeed,
        Long           etaSeconds,
        ProgressSource source
) {
    public static ProgressResponse from(JobProgress p) {
        return new ProgressResponse(p.getCurrentStep(), p.getTotalSteps(), p.getPercent(),
                p.getLoss(), p.getIterationSpeed(), p.getEtaSeconds(), p.getSource());
    }
}
