package com.isengard.orchestrator.events;

import com.isengard.orchestrator.config.OrchestratorProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-node {@link EventBus}: one channel per job, each with a sequence
 * counter, a bounded replay backlog, and a bounded buffer per subscriber.
 *
 * Publishing and subscribing to the same job are serialised on the channel,
 * which is what makes "replay + live tail" gap-free and duplicate-free.
 * Different jobs never share a lock.
 */
@Component
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final Map<UUID, Channel> channels = new ConcurrentHashMap<>();

    private final int      backlogSize;
    private final int      subscriberBuffer;
    private final Duration retention;
    private final Clock    clock;
    private final Counter  published;
    private final Counter  dropped;

    public InMemoryEventBus(OrchestratorProperties props, MeterRegistry meterRegistry, Clock clock) {
        this.backlogSize      = props.getEvents().getBacklogSize();
        this.subscriberBuffer = props.getEvents().getSubscriberBuffer();
        this.retention        = props.getEvents().getRetention();
        this.clock            = clock;
        this.published        = meterRegistry.counter("isengard.events.published");
        this.dropped          = meterRegistry.counter("isengard.events.dropped");
    }

    @Override
    public void open(UUID jobId, long lastSequence) {
        channel(jobId).seed(lastSequence);
    }

    @Override
    public ProgressEvent publish(UUID jobId, ProgressEvent draft) {
        ProgressEvent event = channel(jobId).publish(draft, clock.instant());
        published.increment();
        return event;
    }

    @Override
    public Subscription subscribe(UUID jobId, long afterSequence) {
        return channel(jobId).subscribe(afterSequence);
    }

    @Override
    public long lastSequence(UUID jobId) {
        Channel ch = channels.get(jobId);
        return ch == null ? 0 : ch.lastSequence();
    }

    /**
     * Drop channels nobody needs any more: terminal for longer than the
     * retention window and no subscribers. A live job's channel is kept however
     * quiet it is, since its sequence counter must keep counting.
     */
    @Scheduled(fixedDelayString = "${isengard.events.eviction-interval:60000}")
    public void evictIdleChannels() {
        Instant cutoff = clock.instant().minus(retention);
        channels.entrySet().removeIf(e -> {
            boolean evict = e.getValue().isEvictable(cutoff);
            if (evict) log.debug("Evicting event channel for job {}", e.getKey());
            return evict;
        });
    }

    int channelCount() {
        return channels.size();
    }

    private Channel channel(UUID jobId) {
        return channels.computeIfAbsent(jobId, id -> new Channel());
    }

    // ------------------------------------------------------------------
    // Channel: all state for one job
    // ------------------------------------------------------------------

    private final class Channel {

        private final Deque<ProgressEvent>          backlog     = new ArrayDeque<>();
        private final List<BufferedSubscription>    subscribers = new CopyOnWriteArrayList<>();
        private long    sequence;
        private Instant terminalAt;

        synchronized void seed(long lastSequence) {
            if (lastSequence > sequence) sequence = lastSequence;
        }

        synchronized long lastSequence() {
            return sequence;
        }

        synchronized ProgressEvent publish(ProgressEvent draft, Instant now) {
            ProgressEvent event = draft.stamped(++sequence, now);
            backlog.addLast(event);
            while (backlog.size() > backlogSize) backlog.removeFirst();
            if (event.isTerminal()) terminalAt = now;
            for (BufferedSubscription s : subscribers) {
                s.offer(event);
            }
            return event;
        }

        synchronized Subscription subscribe(long afterSequence) {
            List<ProgressEvent> replay = new ArrayList<>();
            boolean gap = false;
            if (afterSequence != NO_RESUME && afterSequence < sequence) {
                ProgressEvent oldest = backlog.peekFirst();
                if (oldest == null || oldest.sequence() > afterSequence + 1) {
                    gap = true;
                } else {
                    for (ProgressEvent e : backlog) {
                        if (e.sequence() > afterSequence) replay.add(e);
                    }
                }
            } else if (afterSequence > sequence) {
                // Client is ahead of us (e.g. this node restarted): its view can't be trusted.
                gap = true;
            }
            BufferedSubscription sub = new BufferedSubscription(this, replay, gap, sequence);
            subscribers.add(sub);
            return sub;
        }

        void remove(BufferedSubscription sub) {
            subscribers.remove(sub);
        }

        synchronized boolean isEvictable(Instant cutoff) {
            return terminalAt != null && terminalAt.isBefore(cutoff) && subscribers.isEmpty();
        }
    }

    // ------------------------------------------------------------------
    // Subscription with a bounded buffer
    // ------------------------------------------------------------------

    private final class BufferedSubscription implements Subscription {

        private final Channel                      channel;
        private final List<ProgressEvent>          replay;
        private final boolean                      gapExceeded;
        private final long                         sequenceAtSubscribe;
        private final BlockingQueue<ProgressEvent> buffer;
        private final AtomicBoolean                overflowed = new AtomicBoolean(false);
        private final AtomicBoolean                closed     = new AtomicBoolean(false);

        BufferedSubscription(Channel channel, List<ProgressEvent> replay, boolean gapExceeded, long seq) {
            this.channel             = channel;
            this.replay              = List.copyOf(replay);
            this.gapExceeded         = gapExceeded;
            this.sequenceAtSubscribe = seq;
            this.buffer              = new ArrayBlockingQueue<>(subscriberBuffer);
        }

        void offer(ProgressEvent event) {
            if (closed.get() || overflowed.get()) return;
            if (!buffer.offer(event)) {
                overflowed.set(true);
                dropped.increment();
                log.warn("Subscriber for job {} fell behind at sequence {}; dropping live events",
                        event.jobId(), event.sequence());
            }
        }

        @Override public List<ProgressEvent> replay()            { return replay; }
        @Override public boolean             gapExceeded()       { return gapExceeded; }
        @Override public long                sequenceAtSubscribe() { return sequenceAtSubscribe; }
        @Override public boolean             overflowed()        { return overflowed.get(); }

        @Override
        public ProgressEvent poll(Duration timeout) throws InterruptedException {
            return buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                channel.remove(this);
                buffer.clear();
            }
        }
    }
}
