package com.isengard.orchestrator.engine;

import com.isengard.orchestrator.model.Job;
import com.isengard.orchestrator.model.JobKind;
import com.isengard.orchestrator.storage.JobArena;

import java.io.IOException;

/**
 * Knows how to drive one external engine for one job kind.
 *
 * Implementations are Spring beans collected by {@link EngineRegistry}.
 */
public interface EngineAdapter {

    JobKind kind();

    /** Name of the external backend, e.g. "ai-toolkit". */
    String backend();

    /** Stage reported on status events while the engine runs. */
    String runningStage();

    /**
     * Write whatever the engine reads (config.json) into the arena and
     * build the command line. Uses only the job's immutable config.
     */
    EngineCommand prepare(Job job, JobArena.Lease lease) throws IOException;

    /**
     * Scan the arena for final artifacts. Only called at defined checkpoints
     * (after the process exits), never per output line.
     */
    ArtifactCheck collectArtifacts(Job job, JobArena arena) throws IOException;
}
