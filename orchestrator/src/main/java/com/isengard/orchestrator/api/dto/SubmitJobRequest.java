package com.isengard.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for POST /jobs.
 *
 * {@code kind} is "training" or "generation"; {@code config} holds the engine
 * parameters (see GET /capabilities). Missing parameters take their defaults.
 */
public record SubmitJobRequest(String kind, Map<String, Object> config) {

    public SubmitJobRequest {
        if (config == null) config = Map.of();
    }
}
