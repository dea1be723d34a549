package com.isengard.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.isengard.orchestrator.model.Job;
import com.isengard.orchestrator.model.JobArtifact;
import com.isengard.orchestrator.model.JobProgress;
import com.isengard.orchestrator.model.JobStatus;
import com.isengard.orchestrator.storage.JobArena;
import com.isengard.orchestrator.storage.JobArenas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds the support archive for one job.
 *
 * <pre>
 *   &lt;jobId&gt;/metadata.json   job record, sensitive keys masked
 *   &lt;jobId&gt;/config.json     submitted config snapshot, sensitive keys masked
 *   &lt;jobId&gt;/job.log         full engine output, credentials scrubbed
 *   &lt;jobId&gt;/error.json      only for failed jobs
 *   &lt;jobId&gt;/artifacts.json
 *   &lt;jobId&gt;/README.txt      what is inside
 * </pre>
 *
 * This is the only place full diagnostic detail leaves the server.
 */
@Service
public class DebugBundleService {

    private static final Logger log = LoggerFactory.getLogger(DebugBundleService.class);

    private final JobStore     store;
    private final JobArenas    arenas;
    private final ObjectMapper objectMapper;
    private final Clock        clock;

    public DebugBundleService(JobStore store, JobArenas arenas, ObjectMapper objectMapper, Clock clock) {
        this.store        = store;
        this.arenas       = arenas;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    /**
     * @return the ZIP archive bytes
     * @throws JobNotFoundException if the job does not exist
     */
    public byte[] build(UUID jobId) {
        Job job = store.get(jobId);
        JobArena arena = arenas.view(jobId);
        String dir = jobId + "/";
        List<String> contents = new ArrayList<>();

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes, StandardCharsets.UTF_8)) {
            put(zip, dir + "metadata.json", json(Redactor.map(metadata(job))));
            contents.add("metadata.json");

            put(zip, dir + "config.json", json(Redactor.map(job.getConfig().asMap())));
            contents.add("config.json");

            List<String> logLines = arena.readLogLines();
            if (!logLines.isEmpty()) {
                put(zip, dir + "job.log", Redactor.text(String.join("\n", logLines) + "\n"));
                contents.add("job.log");
            }

            if (job.getStatus() == JobStatus.FAILED) {
                Map<String, Object> error = new LinkedHashMap<>();
                error.put("type", job.getErrorType());
                error.put("message", job.getErrorMessage() == null ? null : Redactor.text(job.getErrorMessage()));
                put(zip, dir + "error.json", json(error));
                contents.add("error.json");
            }

            put(zip, dir + "artifacts.json", json(artifacts(job.getArtifacts())));
            contents.add("artifacts.json");

            put(zip, dir + "README.txt", readme(jobId, contents));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot build debug bundle for job " + jobId, e);
        }
        log.info("Debug bundle created for job {}: {}", jobId, contents);
        return bytes.toByteArray();
    }

    private Map<String, Object> metadata(Job job) {
        JobProgress p = job.getProgress();
        Map<String, Object> progress = new LinkedHashMap<>();
        progress.put("current_step", p.getCurrentStep());
        progress.put("total_steps", p.getTotalSteps());
        progress.put("percent", p.getPercent());
        progress.put("loss", p.getLoss());
        progress.put("iteration_speed", p.getIterationSpeed());
        progress.put("eta_seconds", p.getEtaSeconds());
        progress.put("source", p.getSource() == null ? null : p.getSource().wireName());

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("id", job.getId().toString());
        meta.put("kind", job.getKind().name().toLowerCase());
        meta.put("status", job.getStatus().wireName());
        meta.put("created_at", iso(job.getCreatedAt()));
        meta.put("started_at", iso(job.getStartedAt()));
        meta.put("completed_at", iso(job.getCompletedAt()));
        meta.put("updated_at", iso(job.getUpdatedAt()));
        meta.put("deliveries", job.getDeliveries());
        meta.put("last_sequence", job.getLastSequence());
        meta.put("progress", progress);
        meta.put("error_type", job.getErrorType());
        return meta;
    }

    private static List<Map<String, Object>> artifacts(List<JobArtifact> artifacts) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (JobArtifact a : artifacts) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("name", a.getName());
            m.put("path", Redactor.text(a.getPath()));
            m.put("kind", a.getKind().name().toLowerCase());
            m.put("step", a.getStep());
            m.put("created_at", iso(a.getCreatedAt()));
            out.add(m);
        }
        return out;
    }

    private String readme(UUID jobId, List<String> contents) {
        StringBuilder sb = new StringBuilder();
        sb.append("Debug bundle for job ").append(jobId).append('\n');
        sb.append("=".repeat(40)).append("\n\nContents:\n");
        contents.forEach(c -> sb.append("  - ").append(c).append('\n'));
        sb.append("\nGenerated: ").append(clock.instant()).append('\n');
        return sb.toString();
    }

    private String json(Object value) throws IOException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }

    private static void put(ZipOutputStream zip, String name, String content) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        zip.write(content.getBytes(StandardCharsets.UTF_8));
        zip.closeEntry();
    }

    private static String iso(Instant t) {
        return t == null ? null : t.toString();
    }
}
