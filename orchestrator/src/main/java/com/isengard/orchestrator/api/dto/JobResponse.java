package com.isengard.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.isengard.orchestrator.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for POST /jobs, GET /jobs/{id} and the entries of GET /jobs.
 * List entries leave {@code artifacts} out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobResponse(
        UUID                   id,
        String                 kind,
        String                 status,
        Map<String, Object>    config,
        ProgressResponse       progress,
        Instant                createdAt,
        Instant                startedAt,
        Instant                completedAt,
        Instant                updatedAt,
        ErrorResponse          error,
        List<ArtifactResponse> artifacts
) {
    public static JobResponse from(Job job) {
        return build(job, job.getArtifacts().stream().map(ArtifactResponse::from).toList());
    }

    public static JobResponse summary(Job job) {
        return build(job, null);
    }

    private static JobResponse build(Job job, List<ArtifactResponse> artifacts) {
        ErrorResponse error = job.getErrorType() == null ? null
                : new ErrorResponse(job.getErrorType(), job.getErrorMessage(), null);
        return new JobResponse(
                job.getId(),
                job.getKind().name().toLowerCase(),
                job.getStatus().wireName(),
                job.getConfig().asMap(),
                ProgressResponse.from(job.getProgress()),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt(),
                job.getUpdatedAt(),
                error,
                artifacts);
    }
}
