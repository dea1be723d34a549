package com.isengard.orchestrator.events;

import java.util.UUID;

/**
 * Per-job fan-out of stream events from the worker to any number of watchers.
 *
 * Guarantees:
 *   - events of one job reach each subscriber in increasing sequence order;
 *   - a subscriber may resume after a sequence number as long as the missed
 *     events are still in the bounded backlog, otherwise it is told the gap
 *     is too wide and must resynchronise from the job store;
 *   - publish never blocks on a slow subscriber.
 */
public interface EventBus {

    /** Resume token meaning "no replay, live events only". */
    long NO_RESUME = -1L;

    /**
     * Make sure the job's channel exists and its sequence counter is at
     * least {@code lastSequence}. Called before the first publish of a
     * (re)started job so sequences keep increasing across restarts.
     */
    void open(UUID jobId, long lastSequence);

    /**
     * Assign the next sequence to {@code draft}, record it in the backlog
     * and hand it to every subscriber.
     *
     * @return the stamped event
     */
    ProgressEvent publish(UUID jobId, ProgressEvent draft);

    /**
     * Subscribe to a job, replaying everything after {@code afterSequence}
     * (or nothing, for {@link #NO_RESUME}).
     */
    Subscription subscribe(UUID jobId, long afterSequence);

    /** Highest sequence published for the job so far, 0 if none. */
    long lastSequence(UUID jobId);
}
