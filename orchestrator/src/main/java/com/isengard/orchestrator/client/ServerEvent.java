package com.isengard.orchestrator.client;

/**
 * One frame read off a push transport, before decoding.
 * A keepalive carries no data.
 */
public record ServerEvent(String name, String id, String data) {

    public static ServerEvent keepalive() {
        return new ServerEvent(null, null, null);
    }

    public boolean isKeepalive() {
        return data == null;
    }
}
