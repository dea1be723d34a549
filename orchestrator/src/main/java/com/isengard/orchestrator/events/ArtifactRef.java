package com.isengard.orchestrator.events;

import com.isengard.orchestrator.model.ArtifactKind;

public record ArtifactRef(String name, String path, ArtifactKind kind, Integer step) {}
