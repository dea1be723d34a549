package com.isengard.orchestrator.client;

import java.io.IOException;
import java.util.UUID;

/**
 * One connection attempt to a job's event stream. SSE is the shipped
 * implementation; the resume contract is the same for any other push
 * transport.
 */
public interface StreamTransport {

    /**
     * Connect and block until the server closes the stream, the handler
     * asks to stop, or the connection fails.
     *
     * @param lastSequence last sequence seen, or -1 for a fresh connect
     * @throws StreamRejectedException if the server refuses the stream for good (e.g. unknown job)
     * @throws IOException             on any connection-level failure; the caller may retry
     */
    void stream(UUID jobId, long lastSequence, Handler handler) throws IOException;

    interface Handler {

        /** The server accepted the stream. */
        void onOpen();

        /** @return false to stop reading and return */
        boolean onEvent(ServerEvent event);
    }
}
