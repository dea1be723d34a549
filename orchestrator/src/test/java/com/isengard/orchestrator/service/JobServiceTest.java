package com.isengard.orchestrator.service;

import com.isengard.orchestrator.TestJobs;
import com.isengard.orchestrator.events.EventBus;
import com.isengard.orchestrator.events.EventType;
import com.isengard.orchestrator.events.ProgressEvent;
import com.isengard.orchestrator.model.*;
import com.isengard.orchestrator.queue.JobQueue;
import com.isengard.orchestrator.validation.CapabilityCatalog;
import com.isengard.orchestrator.validation.ConfigValidator;
import com.isengard.orchestrator.validation.ValidationException;
import com.isengard.orchestrator.worker.WorkerPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobServiceTest {

    @Mock JobStore   store;
    @Mock JobQueue   queue;
    @Mock EventBus   bus;
    @Mock WorkerPool workers;

    private JobService service;

    @BeforeEach
    void setUp() {
        service = new JobService(new ConfigValidator(new CapabilityCatalog()), store, queue, bus, workers);
    }

    // -------------------------------------------------------------------------
    // submit
    // -------------------------------------------------------------------------

    @Test
    void submit_training_storesPendingJobAndEnqueues() {
        Job created = TestJobs.training(2000);
        when(store.create(eq(JobKind.TRAINING), any(JobConfig.class), eq(2000))).thenReturn(created);

        Job job = service.submit(JobKind.TRAINING, Map.of("steps", 2000));

        assertThat(job).isSameAs(created);
        ArgumentCaptor<JobConfig> config = ArgumentCaptor.forClass(JobConfig.class);
        verify(store).create(eq(JobKind.TRAINING), config.capture(), eq(2000));
        assertThat(config.getValue().get("preset")).isEqualTo("balanced");
        verify(queue).enqueue(created.getId());
    }

    @Test
    void submit_generation_usesImageCountAsTotal() {
        Job created = TestJobs.job(JobKind.GENERATION, Map.of("prompt", "a fox", "count", 4), 4);
        when(store.create(eq(JobKind.GENERATION), any(JobConfig.class), eq(4))).thenReturn(created);

        service.submit(JobKind.GENERATION, Map.of("prompt", "a fox", "count", 4));

        verify(queue).enqueue(created.getId());
    }

    @Test
    void submit_invalidConfig_storesNothing() {
        assertThatThrownBy(() -> service.submit(JobKind.TRAINING, Map.of("steps", 5)))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(store, queue);
    }

    // -------------------------------------------------------------------------
    // cancel
    // -------------------------------------------------------------------------

    @Test
    void cancel_terminalJob_isNoOp() {
        Job job = TestJobs.withStatus(TestJobs.training(100), JobStatus.COMPLETED);
        when(store.get(job.getId())).thenReturn(job);

        assertThat(service.cancel(job.getId())).isEqualTo(CancelOutcome.ALREADY_TERMINAL);
        verify(store, never()).updateStatus(any(), any());
        verifyNoInteractions(workers);
    }

    @Test
    void cancel_jobHeldByWorker_delegatesToWorker() {
        Job job = TestJobs.withStatus(TestJobs.training(100), JobStatus.RUNNING);
        when(store.get(job.getId())).thenReturn(job);
        when(workers.cancel(job.getId())).thenReturn(true);

        assertThat(service.cancel(job.getId())).isEqualTo(CancelOutcome.CANCELLING);
        verify(store, never()).updateStatus(any(), any());
    }

    @Test
    void cancel_pendingJob_cancelsDirectlyAndPublishesComplete() {
        Job job = TestJobs.training(100);
        job.advanceLastSequence(3);
        when(store.get(job.getId())).thenReturn(job);
        when(workers.cancel(job.getId())).thenReturn(false);
        when(bus.publish(eq(job.getId()), any())).thenAnswer(inv ->
                inv.<ProgressEvent>getArgument(1).stamped(4, Instant.EPOCH));

        assertThat(service.cancel(job.getId())).isEqualTo(CancelOutcome.CANCELLED);

        verify(store).updateStatus(job.getId(), JobStatus.CANCELLED);
        verify(bus).open(job.getId(), 3);
        ArgumentCaptor<ProgressEvent> event = ArgumentCaptor.forClass(ProgressEvent.class);
        verify(bus).publish(eq(job.getId()), event.capture());
        assertThat(event.getValue().type()).isEqualTo(EventType.COMPLETE);
        assertThat(event.getValue().status()).isEqualTo("cancelled");
        verify(store).recordSequence(job.getId(), 4);
        verify(queue).ack(job.getId());
    }

    @Test
    void cancel_workerClaimsJobMidCancel_fallsBackToWorker() {
        Job job = TestJobs.training(100);
        when(store.get(job.getId())).thenReturn(job);
        when(workers.cancel(job.getId())).thenReturn(false, true);
        when(store.updateStatus(job.getId(), JobStatus.CANCELLED))
                .thenThrow(new InvalidTransitionException(job.getId(), JobStatus.RUNNING, JobStatus.CANCELLED));

        assertThat(service.cancel(job.getId())).isEqualTo(CancelOutcome.CANCELLING);
        verifyNoInteractions(bus, queue);
    }

    @Test
    void cancel_jobFinishesMidCancel_reportsAlreadyTerminal() {
        Job pending = TestJobs.training(100);
        Job finished = TestJobs.withStatus(TestJobs.training(100), JobStatus.FAILED);
        when(store.get(pending.getId())).thenReturn(pending, finished);
        when(workers.cancel(pending.getId())).thenReturn(false);
        when(store.updateStatus(pending.getId(), JobStatus.CANCELLED))
                .thenThrow(new InvalidTransitionException(pending.getId(), JobStatus.FAILED, JobStatus.CANCELLED));

        assertThat(service.cancel(pending.getId())).isEqualTo(CancelOutcome.ALREADY_TERMINAL);
    }
}
