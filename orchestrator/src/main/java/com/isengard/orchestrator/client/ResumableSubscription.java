package com.isengard.orchestrator.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.isengard.orchestrator.events.EventType;
import com.isengard.orchestrator.events.ProgressEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Client side of a job stream that survives disconnects.
 *
 * <ul>
 *   <li>Tracks the last sequence seen and sends it on every reconnect so
 *       the server can replay the gap.</li>
 *   <li>Drops duplicates by sequence.</li>
 *   <li>Treats a snapshot as authoritative (the listener resets its view).</li>
 *   <li>Reconnects after any close that is not the terminal event, with
 *       {@link ReconnectBackoff}; never reconnects after the terminal event
 *       or {@link #close()}.</li>
 * </ul>
 */
public class ResumableSubscription implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResumableSubscription.class);

    /** Where connection attempts run. */
    @FunctionalInterface
    public interface Scheduler {
        void schedule(Runnable task, Duration delay);

        static Scheduler of(ScheduledExecutorService executor) {
            return (task, delay) -> executor.schedule(task, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private final UUID             jobId;
    private final StreamTransport  transport;
    private final StreamListener   listener;
    private final ReconnectBackoff backoff;
    private final Scheduler        scheduler;
    private final ObjectMapper     json;

    private volatile long    lastSeen = -1L;
    private volatile boolean completed;
    private volatile boolean closed;
    private volatile boolean started;

    public ResumableSubscription(UUID jobId,
                                 StreamTransport transport,
                                 StreamListener listener,
                                 ReconnectBackoff backoff,
                                 Scheduler scheduler,
                                 ObjectMapper json) {
        this.jobId     = jobId;
        this.transport = transport;
        this.listener  = listener;
        this.backoff   = backoff;
        this.scheduler = scheduler;
        this.json      = json;
    }

    public synchronized void start() {
        if (started) return;
        started = true;
        scheduler.schedule(this::attempt, Duration.ZERO);
    }

    public long lastSeenSequence() { return lastSeen; }
    public boolean isCompleted()   { return completed; }

    @Override
    public void close() {
        closed = true;
    }

    // ------------------------------------------------------------------
    // Connection attempts
    // ------------------------------------------------------------------

    private void attempt() {
        if (finished()) return;
        Exception cause = null;
        try {
            transport.stream(jobId, lastSeen, new StreamTransport.Handler() {
                @Override
                public void onOpen() {
                    backoff.reset();
                }

                @Override
                public boolean onEvent(ServerEvent event) {
                    if (!event.isKeepalive()) handle(event);
                    return !finished();
                }
            });
        } catch (StreamRejectedException e) {
            log.warn("Stream for job {} rejected ({}): {}", jobId, e.getStatus(), e.getMessage());
            closed = true;
            listener.onFailure(e);
            return;
        } catch (IOException | RuntimeException e) {
            cause = e;
        }
        if (finished()) return;

        Duration delay = backoff.nextDelay();
        log.info("Stream for job {} dropped after sequence {}; reconnecting in {}", jobId, lastSeen, delay);
        listener.onReconnecting(delay, cause);
        scheduler.schedule(this::attempt, delay);
    }

    private void handle(ServerEvent frame) {
        ProgressEvent event;
        try {
            event = json.readValue(frame.data(), ProgressEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring undecodable event on job {} stream: {}", jobId, e.getOriginalMessage());
            return;
        }

        if (event.type() == EventType.COMPLETE) {
            lastSeen  = Math.max(lastSeen, event.sequence());
            completed = true;
            listener.onComplete(event);
            return;
        }
        if (event.type() == EventType.SNAPSHOT) {
            lastSeen = event.sequence();
            listener.onSnapshot(event);
            return;
        }
        if (event.sequence() <= lastSeen) {
            return;
        }
        lastSeen = event.sequence();
        listener.onEvent(event);
    }

    private boolean finished() {
        return completed || closed;
    }
}
