package com.isengard.orchestrator.api;

import com.isengard.orchestrator.api.dto.*;
import com.isengard.orchestrator.model.Job;
import com.isengard.orchestrator.model.JobKind;
import com.isengard.orchestrator.model.StatusGroup;
import com.isengard.orchestrator.service.CancelOutcome;
import com.isengard.orchestrator.service.DebugBundleService;
import com.isengard.orchestrator.service.JobFilter;
import com.isengard.orchestrator.service.JobLogService;
import com.isengard.orchestrator.service.JobService;
import com.isengard.orchestrator.service.JobStore;
import com.isengard.orchestrator.stream.JobStreamService;
import com.isengard.orchestrator.validation.ValidationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Function;

/**
 * REST and SSE surface for jobs.
 *
 * POST /jobs                      submit (201, or 422 on a rejected config)
 * GET  /jobs                      list, filtered by status_group and kind, newest first
 * GET  /jobs/{id}                 current snapshot
 * POST /jobs/{id}/cancel          idempotent cancel
 * GET  /jobs/{id}/stream          server-sent events, resumable by Last-Event-ID
 * GET  /jobs/{id}/logs            full job log as text
 * GET  /jobs/{id}/logs/view       paginated log window
 * GET  /jobs/{id}/artifacts       ordered artifact list
 * GET  /jobs/{id}/debug-bundle    support ZIP
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobService         jobService;
    private final JobStore           jobStore;
    private final JobStreamService   streams;
    private final JobLogService      logs;
    private final DebugBundleService debugBundles;

    public JobController(JobService jobService,
                         JobStore jobStore,
                         JobStreamService streams,
                         JobLogService logs,
                         DebugBundleService debugBundles) {
        this.jobService   = jobService;
        this.jobStore     = jobStore;
        this.streams      = streams;
        this.logs         = logs;
        this.debugBundles = debugBundles;
    }

    /**
     * Submit a job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"kind":"training","config":{"steps":1000,"resolution":1024}}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> submit(@RequestBody SubmitJobRequest req) {
        JobKind kind = parse("kind", req.kind(), JobKind::fromParam);
        if (kind == null) {
            throw new ValidationException("kind", "kind is required (training or generation)");
        }
        Job job = jobService.submit(kind, req.config());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    @GetMapping
    public JobListResponse list(@RequestParam(name = "status_group", required = false) String statusGroup,
                                @RequestParam(name = "kind", required = false) String kind,
                                @RequestParam(name = "page", defaultValue = "0") int page,
                                @RequestParam(name = "size", defaultValue = "50") int size) {
        JobFilter filter = new JobFilter(
                parse("status_group", statusGroup, StatusGroup::fromParam),
                parse("kind", kind, JobKind::fromParam),
                page,
                size);
        return JobListResponse.from(jobService.list(filter));
    }

    @GetMapping("/{id}")
    public JobResponse get(@PathVariable UUID id) {
        return JobResponse.from(jobService.get(id));
    }

    @PostMapping("/{id}/cancel")
    public CancelResponse cancel(@PathVariable UUID id) {
        CancelOutcome outcome = jobService.cancel(id);
        String status = jobService.get(id).getStatus().wireName();
        return new CancelResponse(id, outcome.name().toLowerCase(Locale.ROOT), status);
    }

    /**
     * Live event stream. Opens with a snapshot (or a replay of what a
     * reconnecting client missed) and closes after the complete event.
     * Browsers' EventSource sends Last-Event-ID itself; other clients may
     * pass {@code last_event_id} instead.
     */
    @GetMapping(value = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable UUID id,
                             @RequestHeader(name = "Last-Event-ID", required = false) String lastEventId,
                             @RequestParam(name = "last_event_id", required = false) String lastEventIdParam) {
        return streams.open(id, lastEventId != null ? lastEventId : lastEventIdParam);
    }

    @GetMapping(value = "/{id}/logs", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> downloadLog(@PathVariable UUID id) {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + id + ".log\"")
                .contentType(MediaType.TEXT_PLAIN)
                .body(logs.fullText(id));
    }

    @GetMapping("/{id}/logs/view")
    public LogViewResponse viewLog(@PathVariable UUID id,
                                   @RequestParam(name = "offset", defaultValue = "0") int offset,
                                   @RequestParam(name = "limit", defaultValue = "100") int limit) {
        return LogViewResponse.from(id, logs.view(id, offset, limit));
    }

    @GetMapping("/{id}/artifacts")
    public List<ArtifactResponse> artifacts(@PathVariable UUID id) {
        return jobStore.artifacts(id).stream().map(ArtifactResponse::from).toList();
    }

    @GetMapping("/{id}/debug-bundle")
    public ResponseEntity<byte[]> debugBundle(@PathVariable UUID id) {
        byte[] zip = debugBundles.build(id);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + id + "_debug.zip\"")
                .contentType(MediaType.parseMediaType("application/zip"))
                .body(zip);
    }

    private static <T> T parse(String field, String value, Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field, "Unknown " + field + " '" + value + "'");
        }
    }
}
