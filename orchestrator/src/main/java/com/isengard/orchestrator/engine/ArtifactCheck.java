package com.isengard.orchestrator.engine;

import com.isengard.orchestrator.model.ArtifactDraft;

import java.util.List;

/**
 * What an engine left in the arena after a clean exit.
 *
 * @param problem why the expected final artifacts are missing, or null if they are all there
 */
public record ArtifactCheck(List<ArtifactDraft> found, String problem) {

    public static ArtifactCheck complete(List<ArtifactDraft> found) {
        return new ArtifactCheck(List.copyOf(found), null);
    }

    public static ArtifactCheck incomplete(List<ArtifactDraft> found, String problem) {
        return new ArtifactCheck(List.copyOf(found), problem);
    }

    public boolean ok() {
        return problem == null;
    }
}
