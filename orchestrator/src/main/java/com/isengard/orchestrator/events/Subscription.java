package com.isengard.orchestrator.events;

import java.time.Duration;
import java.util.List;

/**
 * One subscriber's handle on a job channel.
 *
 * Replayed events come first via {@link #replay()}; live events follow via
 * {@link #poll}. The two never overlap and never leave a hole.
 */
public interface Subscription extends AutoCloseable {

    /** Events the subscriber missed, oldest first. Empty if the gap was too wide. */
    List<ProgressEvent> replay();

    /**
     * True when the requested resume point is no longer in the backlog. The
     * subscriber must resynchronise from a full snapshot; live events still flow.
     */
    boolean gapExceeded();

    /** The channel's last sequence at the moment of subscribing. */
    long sequenceAtSubscribe();

    /**
     * Next live event, or null if none arrived within {@code timeout}.
     */
    ProgressEvent poll(Duration timeout) throws InterruptedException;

    /**
     * True once at least one live event was dropped because this subscriber
     * fell behind its buffer. The subscriber should resubscribe from the
     * last sequence it delivered.
     */
    boolean overflowed();

    @Override
    void close();
}
