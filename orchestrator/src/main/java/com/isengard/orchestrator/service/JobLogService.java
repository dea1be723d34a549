package com.isengard.orchestrator.service;

import com.isengard.orchestrator.storage.JobArena;
import com.isengard.orchestrator.storage.JobArenas;
import com.isengard.orchestrator.validation.ValidationException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.UUID;

/**
 * Read access to per-job logs for clients that do not stream.
 */
@Service
public class JobLogService {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT     = 1000;

    private final JobStore  store;
    private final JobArenas arenas;

    public JobLogService(JobStore store, JobArenas arenas) {
        this.store  = store;
        this.arenas = arenas;
    }

    /**
     * @throws ValidationException  if offset is negative or limit is outside 1..1000
     * @throws JobNotFoundException if the job does not exist
     */
    public LogPage view(UUID jobId, int offset, int limit) {
        if (offset < 0) {
            throw new ValidationException("offset", "offset must be >= 0");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("limit", "limit must be between 1 and " + MAX_LIMIT);
        }
        List<String> all = lines(jobId);
        int from = Math.min(offset, all.size());
        int to   = Math.min(from + limit, all.size());
        return new LogPage(List.copyOf(all.subList(from, to)), offset, limit, all.size(), to < all.size());
    }

    /** The whole log; empty if the job has not produced output yet. */
    public String fullText(UUID jobId) {
        List<String> all = lines(jobId);
        return all.isEmpty() ? "" : String.join("\n", all) + "\n";
    }

    private List<String> lines(UUID jobId) {
        store.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        JobArena arena = arenas.view(jobId);
        try {
            return arena.readLogLines();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read log of job " + jobId, e);
        }
    }
}
