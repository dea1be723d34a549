package com.isengard.orchestrator.stream;

import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/** {@link EventSink} over a Spring {@link SseEmitter}. */
public class SseEventSink implements EventSink {

    private final SseEmitter emitter;

    public SseEventSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(String eventName, String id, Object data) throws IOException {
        emitter.send(SseEmitter.event()
                .name(eventName)
                .id(id)
                .data(data, MediaType.APPLICATION_JSON));
    }

    @Override
    public void keepalive() throws IOException {
        emitter.send(SseEmitter.event().comment("keepalive"));
    }

    @Override
    public void complete() {
        emitter.complete();
    }
}
