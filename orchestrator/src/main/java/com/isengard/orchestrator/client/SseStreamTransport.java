package com.isengard.orchestrator.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;

/**
 * Server-sent events over java.net.http.HttpClient against
 * {@code GET /jobs/{id}/stream}.
 */
public class SseStreamTransport implements StreamTransport {

    private static final Logger log = LoggerFactory.getLogger(SseStreamTransport.class);

    private final HttpClient http;
    private final URI        baseUrl;

    public SseStreamTransport(URI baseUrl) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build(), baseUrl);
    }

    public SseStreamTransport(HttpClient http, URI baseUrl) {
        this.http    = http;
        this.baseUrl = baseUrl;
    }

    @Override
    public void stream(UUID jobId, long lastSequence, Handler handler) throws IOException {
        HttpRequest.Builder req = HttpRequest.newBuilder(baseUrl.resolve("/jobs/" + jobId + "/stream"))
                .header("Accept", "text/event-stream")
                .GET();
        if (lastSequence >= 0) {
            req.header("Last-Event-ID", Long.toString(lastSequence));
        }

        HttpResponse<InputStream> resp;
        try {
            resp = http.send(req.build(), HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while connecting to stream of job " + jobId);
        }

        try (InputStream body = resp.body()) {
            int status = resp.statusCode();
            if (status >= 400 && status < 500) {
                throw new StreamRejectedException(status, "Stream of job " + jobId + " refused with HTTP " + status);
            }
            if (status != 200) {
                throw new IOException("Stream of job " + jobId + " returned HTTP " + status);
            }
            handler.onOpen();
            log.debug("Connected to stream of job {} (resume after {})", jobId, lastSequence);
            read(new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8)), handler);
        }
    }

    /** Minimal SSE framing: event, id, data (multi-line), comments as keepalives. */
    static void read(BufferedReader reader, Handler handler) throws IOException {
        String name = null;
        String id = null;
        StringBuilder data = null;
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isEmpty()) {
                if (data != null && !handler.onEvent(new ServerEvent(name, id, data.toString()))) return;
                name = null;
                id = null;
                data = null;
            } else if (line.startsWith(":")) {
                if (!handler.onEvent(ServerEvent.keepalive())) return;
            } else {
                int colon = line.indexOf(':');
                String field = colon < 0 ? line : line.substring(0, colon);
                String value = colon < 0 ? "" : line.substring(colon + 1);
                if (value.startsWith(" ")) value = value.substring(1);
                switch (field) {
                    case "event" -> name = value;
                    case "id"    -> id = value;
                    case "data"  -> data = data == null ? new StringBuilder(value) : data.append('\n').append(value);
                    default      -> { }
                }
            }
        }
    }
}
