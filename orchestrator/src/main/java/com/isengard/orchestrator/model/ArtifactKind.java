package com.isengard.orchestrator.model;

public enum ArtifactKind {
    SAMPLE,
    CHECKPOINT,
    MODEL,
    IMAGE
}
