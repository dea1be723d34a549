package com.isengard.orchestrator.stream;

import com.isengard.orchestrator.events.EventBus;
import com.isengard.orchestrator.events.ProgressEvent;
import com.isengard.orchestrator.events.Subscription;
import com.isengard.orchestrator.model.Job;
import com.isengard.orchestrator.service.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One client's live connection to one job.
 *
 * Opening:
 *   - fresh connect, or resume point outside the backlog → full snapshot, then live tail;
 *   - resume within the backlog → exactly the missed events, then live tail.
 * The session ends exactly once: right after the job's COMPLETE event is
 * sent (or the snapshot shows the job already terminal), or when the client
 * goes away. While idle it sends a keepalive every {@code keepalive}.
 *
 * A subscriber that falls behind its buffer is resubscribed from the last
 * sequence it delivered, which degrades to a snapshot if that is too old.
 */
public class StreamSession implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(StreamSession.class);

    private final UUID      jobId;
    private final long      resumeAfter;
    private final EventSink sink;
    private final EventBus  bus;
    private final JobStore  jobStore;
    private final Duration  keepalive;
    private final Clock     clock;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private long delivered = EventBus.NO_RESUME;

    public StreamSession(UUID jobId, long resumeAfter, EventSink sink, EventBus bus,
                         JobStore jobStore, Duration keepalive, Clock clock) {
        this.jobId       = jobId;
        this.resumeAfter = resumeAfter;
        this.sink        = sink;
        this.bus         = bus;
        this.jobStore    = jobStore;
        this.keepalive   = keepalive;
        this.clock       = clock;
    }

    @Override
    public void run() {
        Subscription sub = null;
        try {
            sub = attach(resumeAfter, true);
            while (!closed.get()) {
                if (sub.overflowed()) {
                    log.info("Stream for job {} fell behind; resubscribing after {}", jobId, delivered);
                    sub.close();
                    sub = attach(delivered, false);
                    continue;
                }
                ProgressEvent event = sub.poll(keepalive);
                if (event == null) {
                    sink.keepalive();
                } else if (event.sequence() > delivered) {
                    deliver(event);
                }
            }
        } catch (IOException e) {
            log.debug("Client left stream for job {}: {}", jobId, e.getMessage());
            closed.set(true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
        } catch (RuntimeException e) {
            log.warn("Stream for job {} aborted: {}", jobId, e.getMessage(), e);
            close();
        } finally {
            if (sub != null) sub.close();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Subscribe and send whatever brings the client up to date: a replay if
     * the gap is in the backlog, a snapshot otherwise.
     */
    private Subscription attach(long after, boolean initial) throws IOException {
        Subscription sub = bus.subscribe(jobId, after);
        boolean needSnapshot = (initial && after == EventBus.NO_RESUME) || sub.gapExceeded();
        if (needSnapshot) {
            if (sub.gapExceeded()) {
                log.info("Resume point {} for job {} is outside the backlog; sending snapshot", after, jobId);
            }
            sendSnapshot(sub.sequenceAtSubscribe());
        } else {
            for (ProgressEvent e : sub.replay()) {
                if (closed.get()) break;
                if (e.sequence() > delivered) deliver(e);
            }
            if (delivered == EventBus.NO_RESUME) {
                delivered = after;
            }
        }
        return sub;
    }

    private void sendSnapshot(long sequence) throws IOException {
        Job job = jobStore.get(jobId);
        // a freshly restarted channel may be behind what the store recorded
        bus.open(jobId, job.getLastSequence());
        long seq = Math.max(sequence, job.getLastSequence());
        ProgressEvent snapshot = SnapshotEvents.of(job, seq, clock.instant());
        deliver(snapshot);
    }

    private void deliver(ProgressEvent event) throws IOException {
        if (closed.get()) return;
        sink.send(event.type().wireName(), Long.toString(event.sequence()), event);
        delivered = Math.max(delivered, event.sequence());
        if (event.isTerminal()) {
            close();
        }
    }

    private void close() {
        if (closed.compareAndSet(false, true)) {
            sink.complete();
        }
    }
}
