package com.isengard.orchestrator.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event kinds on a job stream. The wire name doubles as the SSE event name.
 */
public enum EventType {
    SNAPSHOT,   // full current state; replaces anything the client assembled so far
    STATUS,     // lifecycle change that is not terminal
    PROGRESS,
    LOG,
    ARTIFACT,
    COMPLETE;   // terminal; the stream closes after it

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
