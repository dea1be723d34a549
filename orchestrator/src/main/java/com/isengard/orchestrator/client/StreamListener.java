package com.isengard.orchestrator.client;

import com.isengard.orchestrator.events.ProgressEvent;

import java.time.Duration;

/**
 * Receives decoded events from a {@link ResumableSubscription}. Called on the
 * subscription's connection thread, one event at a time.
 */
public interface StreamListener {

    /**
     * Full job state. Replaces anything derived from earlier events; after a
     * long disconnect this is all the client gets instead of the missed events.
     */
    void onSnapshot(ProgressEvent snapshot);

    void onEvent(ProgressEvent event);

    /** Terminal event. No further callbacks follow and no reconnect is attempted. */
    void onComplete(ProgressEvent complete);

    default void onReconnecting(Duration delay, Exception cause) {}

    /** The subscription gave up (stream rejected by the server). */
    default void onFailure(Exception cause) {}
}
