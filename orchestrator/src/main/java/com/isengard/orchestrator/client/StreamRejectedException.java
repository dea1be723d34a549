package com.isengard.orchestrator.client;

import java.io.IOException;

/**
 * The server answered the stream request with a client error; retrying
 * would get the same answer.
 */
public class StreamRejectedException extends IOException {

    private final int status;

    public StreamRejectedException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() { return status; }
}
