package com.isengard.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.isengard.orchestrator.model.JobArtifact;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ArtifactResponse(String name, String path, String kind, Integer step, Instant createdAt) {

    public static ArtifactResponse from(JobArtifact a) {
        return new ArtifactResponse(a.getName(), a.getPath(), a.getKind().name().toLowerCase(),
                a.getStep(), a.getCreatedAt());
    }
}
