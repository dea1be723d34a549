package com.isengard.orchestrator.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.UUID;

/**
 * @param outcome cancelled, cancelling or already_terminal
 * @param status  the job's status after the request
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CancelResponse(UUID jobId, String outcome, String status) {}
