package com.isengard.orchestrator.api;

import com.isengard.orchestrator.TestJobs;
import com.isengard.orchestrator.model.*;
import com.isengard.orchestrator.service.*;
import com.isengard.orchestrator.stream.JobStreamService;
import com.isengard.orchestrator.validation.ValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for JobController: web layer only, every collaborator mocked.
 */
@WebMvcTest(JobController.class)
class JobControllerTest {

    @Autowired MockMvc mockMvc;

    @MockitoBean JobService         jobService;
    @MockitoBean JobStore           jobStore;
    @MockitoBean JobStreamService   streams;
    @MockitoBean JobLogService      logs;
    @MockitoBean DebugBundleService debugBundles;

    // ------------------------------------------------------------------
    // POST /jobs
    // ------------------------------------------------------------------

    @Test
    void submit_validRequest_returns201WithPendingJob() throws Exception {
        Job job = TestJobs.training(1000);
        when(jobService.submit(eq(JobKind.TRAINING), any())).thenReturn(job);

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"kind":"training","config":{"steps":1000}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(job.getId().toString()))
                .andExpect(jsonPath("$.kind").value("training"))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.progress.total_steps").value(1000));
    }

    @Test
    void submit_rejectedConfig_returns422WithViolations() throws Exception {
        when(jobService.submit(eq(JobKind.TRAINING), any())).thenThrow(new ValidationException(List.of(
                new ValidationException.Violation("steps", "Parameter 'steps' value 5.0 is below minimum 100"))));

        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"kind":"training","config":{"steps":5}}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.type").value("ValidationError"))
                .andExpect(jsonPath("$.violations[0].field").value("steps"));
    }

    @Test
    void submit_unknownKind_returns422() throws Exception {
        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"kind":"upscale"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.violations[0].field").value("kind"));
        verifyNoInteractions(jobService);
    }

    @Test
    void submit_malformedBody_returns400() throws Exception {
        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("BadRequest"));
    }

    // ------------------------------------------------------------------
    // GET /jobs, GET /jobs/{id}
    // ------------------------------------------------------------------

    @Test
    void list_ongoingGroup_passesFilterAndOmitsArtifacts() throws Exception {
        Job job = TestJobs.withStatus(TestJobs.training(100), JobStatus.RUNNING);
        when(jobService.list(any())).thenReturn(new PageImpl<>(List.of(job), PageRequest.of(0, 50), 1));

        mockMvc.perform(get("/jobs").param("status_group", "ongoing").param("kind", "training"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobs[0].status").value("running"))
                .andExpect(jsonPath("$.jobs[0].artifacts").doesNotExist())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.has_more").value(false));

        verify(jobService).list(new JobFilter(StatusGroup.ONGOING, JobKind.TRAINING, 0, 50));
    }

    @Test
    void list_unknownStatusGroup_returns422() throws Exception {
        mockMvc.perform(get("/jobs").param("status_group", "sometimes"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.violations[0].field").value("status_group"));
    }

    @Test
    void get_failedJob_includesError() throws Exception {
        Job job = TestJobs.withStatus(TestJobs.training(100), JobStatus.FAILED);
        job.setError("LaunchError", "Cannot start 'python'");
        when(jobService.get(job.getId())).thenReturn(job);

        mockMvc.perform(get("/jobs/{id}", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.error.type").value("LaunchError"))
                .andExpect(jsonPath("$.artifacts").isArray());
    }

    @Test
    void get_unknownId_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(jobService.get(id)).thenThrow(new JobNotFoundException(id));

        mockMvc.perform(get("/jobs/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value("NotFound"));
    }

    @Test
    void get_malformedId_returns400() throws Exception {
        mockMvc.perform(get("/jobs/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // POST /jobs/{id}/cancel
    // ------------------------------------------------------------------

    @Test
    void cancel_runningJob_reportsCancelling() throws Exception {
        Job job = TestJobs.withStatus(TestJobs.training(100), JobStatus.RUNNING);
        when(jobService.cancel(job.getId())).thenReturn(CancelOutcome.CANCELLING);
        when(jobService.get(job.getId())).thenReturn(job);

        mockMvc.perform(post("/jobs/{id}/cancel", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job_id").value(job.getId().toString()))
                .andExpect(jsonPath("$.outcome").value("cancelling"))
                .andExpect(jsonPath("$.status").value("running"));
    }

    // ------------------------------------------------------------------
    // streams, logs, artifacts, debug bundle
    // ------------------------------------------------------------------

    @Test
    void stream_passesLastEventIdHeader() throws Exception {
        UUID id = UUID.randomUUID();
        when(streams.open(id, "17")).thenReturn(new SseEmitter());

        mockMvc.perform(get("/jobs/{id}/stream", id).header("Last-Event-ID", "17"))
                .andExpect(request().asyncStarted());

        verify(streams).open(id, "17");
    }

    @Test
    void stream_acceptsResumeQueryParam() throws Exception {
        UUID id = UUID.randomUUID();
        when(streams.open(id, "9")).thenReturn(new SseEmitter());

        mockMvc.perform(get("/jobs/{id}/stream", id).param("last_event_id", "9"))
                .andExpect(request().asyncStarted());

        verify(streams).open(id, "9");
    }

    @Test
    void logs_downloadAsAttachment() throws Exception {
        UUID id = UUID.randomUUID();
        when(logs.fullText(id)).thenReturn("line 1\nline 2\n");

        mockMvc.perform(get("/jobs/{id}/logs", id))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString(id + ".log")))
                .andExpect(content().string("line 1\nline 2\n"));
    }

    @Test
    void logsView_returnsWindow() throws Exception {
        UUID id = UUID.randomUUID();
        when(logs.view(id, 10, 2)).thenReturn(new LogPage(List.of("a", "b"), 10, 2, 40, true));

        mockMvc.perform(get("/jobs/{id}/logs/view", id).param("offset", "10").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lines[1]").value("b"))
                .andExpect(jsonPath("$.total_lines").value(40))
                .andExpect(jsonPath("$.has_more").value(true));
    }

    @Test
    void artifacts_listedInOrder() throws Exception {
        Job job = TestJobs.withStatus(TestJobs.training(100), JobStatus.RUNNING);
        JobArtifact sample = JobArtifact.attach(job, "s250.png", "/data/s250.png", ArtifactKind.SAMPLE, 250,
                TestJobs.CREATED_AT);
        JobArtifact model = JobArtifact.attach(job, "aria.safetensors", "/data/aria.safetensors", ArtifactKind.MODEL, null,
                TestJobs.CREATED_AT);
        when(jobStore.artifacts(job.getId())).thenReturn(List.of(sample, model));

        mockMvc.perform(get("/jobs/{id}/artifacts", job.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("s250.png"))
                .andExpect(jsonPath("$[0].step").value(250))
                .andExpect(jsonPath("$[1].kind").value("model"));
    }

    @Test
    void debugBundle_servedAsZip() throws Exception {
        UUID id = UUID.randomUUID();
        when(debugBundles.build(id)).thenReturn(new byte[] {'P', 'K', 3, 4});

        mockMvc.perform(get("/jobs/{id}/debug-bundle", id))
                .andExpect(status().isOk())
                .andExpect(content().contentType("application/zip"))
                .andExpect(header().string("Content-Disposition", containsString("_debug.zip")));
    }

    @Test
    void unexpectedError_returns500WithoutDetails() throws Exception {
        UUID id = UUID.randomUUID();
        when(jobService.get(id)).thenThrow(new IllegalStateException("db exploded"));

        mockMvc.perform(get("/jobs/{id}", id))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.type").value("InternalError"))
                .andExpect(jsonPath("$.message").value("Internal server error"));
    }
}
