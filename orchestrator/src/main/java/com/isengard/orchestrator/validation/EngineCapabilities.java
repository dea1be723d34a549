package com.isengard.orchestrator.validation;

import java.util.List;
import java.util.Optional;

/**
 * What one engine backend accepts.
 */
public record EngineCapabilities(String backend, List<ParameterSpec> parameters) {

    public Optional<ParameterSpec> parameter(String name) {
        return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
    }
}
