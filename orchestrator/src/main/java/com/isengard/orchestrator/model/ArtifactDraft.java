package com.isengard.orchestrator.model;

/** An artifact about to be recorded; see JobStore#appendArtifact. */
public record ArtifactDraft(String name, String path, ArtifactKind kind, Integer step) {}
