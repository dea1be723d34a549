package com.isengard.orchestrator.storage;

import com.isengard.orchestrator.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out per-job arenas under {@code isengard.storage.root/jobs/<id>}.
 *
 * At most one writable lease per job exists at a time; a second
 * {@link #acquire} for the same job fails instead of sharing the log.
 */
@Component
public class JobArenas {

    private final Path      jobsRoot;
    private final Set<UUID> leased = ConcurrentHashMap.newKeySet();

    public JobArenas(OrchestratorProperties props) {
        this.jobsRoot = props.getStorage().getRoot().toAbsolutePath().normalize().resolve("jobs");
    }

    /** Read-only view; the directory may not exist yet. */
    public JobArena view(UUID jobId) {
        return new JobArena(jobId, jobsRoot.resolve(jobId.toString()));
    }

    /**
     * @throws IllegalStateException if another lease on the job is still open
     */
    public JobArena.Lease acquire(UUID jobId) {
        if (!leased.add(jobId)) {
            throw new IllegalStateException("Arena of job " + jobId + " is already leased");
        }
        return new JobArena.Lease(view(jobId), () -> leased.remove(jobId));
    }

    public boolean isLeased(UUID jobId) {
        return leased.contains(jobId);
    }
}
