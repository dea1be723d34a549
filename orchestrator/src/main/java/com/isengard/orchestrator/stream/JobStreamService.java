package com.isengard.orchestrator.stream;

import com.isengard.orchestrator.config.OrchestratorProperties;
import com.isengard.orchestrator.events.EventBus;
import com.isengard.orchestrator.service.JobNotFoundException;
import com.isengard.orchestrator.service.JobStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Opens server-push streams for jobs.
 *
 * Each stream gets its own session task on a dedicated pool, so a session
 * waiting on a slow client never holds a servlet thread or a worker thread.
 */
@Service
public class JobStreamService {

    private static final Logger log = LoggerFactory.getLogger(JobStreamService.class);

    private final EventBus       bus;
    private final JobStore       jobStore;
    private final Clock          clock;
    private final Duration       keepalive;
    private final ExecutorService sessions;

    public JobStreamService(EventBus bus, JobStore jobStore, Clock clock, OrchestratorProperties props) {
        this.bus       = bus;
        this.jobStore  = jobStore;
        this.clock     = clock;
        this.keepalive = props.getEvents().getKeepaliveInterval();
        this.sessions  = Executors.newCachedThreadPool(namedThreads("stream-"));
    }

    /**
     * Open a stream for a job.
     *
     * @param lastEventId the last sequence the client saw, or null for a fresh connect
     * @throws JobNotFoundException before any stream is opened, so the caller can answer 404
     */
    public SseEmitter open(UUID jobId, String lastEventId) {
        if (jobStore.find(jobId).isEmpty()) {
            throw new JobNotFoundException(jobId);
        }
        long resumeAfter = parseResumeToken(lastEventId);

        // 0 = no server-side timeout; keepalives and client reconnects cover dead connections.
        SseEmitter emitter = new SseEmitter(0L);
        StreamSession session = new StreamSession(jobId, resumeAfter, new SseEventSink(emitter),
                bus, jobStore, keepalive, clock);
        sessions.execute(session);
        log.debug("Opened stream for job {} (resume after {})", jobId, resumeAfter);
        return emitter;
    }

    @PreDestroy
    void shutdown() {
        sessions.shutdownNow();
    }

    static long parseResumeToken(String lastEventId) {
        if (lastEventId == null || lastEventId.isBlank()) return EventBus.NO_RESUME;
        try {
            long v = Long.parseLong(lastEventId.trim());
            return v < 0 ? EventBus.NO_RESUME : v;
        } catch (NumberFormatException e) {
            return EventBus.NO_RESUME;   // unusable token: start over with a snapshot
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
