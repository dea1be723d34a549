package com.isengard.orchestrator.stream;

import java.io.IOException;

/**
 * Transport-neutral push target for a stream session (SSE today; a
 * WebSocket or long-poll adapter would implement the same three calls).
 */
public interface EventSink {

    void send(String eventName, String id, Object data) throws IOException;

    /** Keepalive that carries no event, used to detect half-open connections. */
    void keepalive() throws IOException;

    /** Close the connection cleanly. Called at most once per session. */
    void complete();
}
