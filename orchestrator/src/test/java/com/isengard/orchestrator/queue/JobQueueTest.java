package com.isengard.orchestrator.queue;

import com.isengard.orchestrator.MutableClock;
import com.isengard.orchestrator.config.OrchestratorProperties;
import com.isengard.orchestrator.model.QueueEntry;
import com.isengard.orchestrator.repository.QueueEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobQueueTest {

    @Mock QueueEntryRepository       queueRepo;
    @Mock PlatformTransactionManager txManager;

    private MutableClock clock;
    private JobQueue     queue;

    @BeforeEach
    void setUp() {
        OrchestratorProperties props = new OrchestratorProperties();
        props.getQueue().setVisibilityTimeout(Duration.ofMinutes(5));
        clock = MutableClock.atEpoch();
        queue = new JobQueue(queueRepo, new TransactionTemplate(txManager), clock, props);
    }

    // -------------------------------------------------------------------------
    // enqueue
    // -------------------------------------------------------------------------

    @Test
    void enqueue_newJob_savesEntry() {
        UUID jobId = UUID.randomUUID();
        when(queueRepo.existsById(jobId)).thenReturn(false);

        assertThat(queue.enqueue(jobId)).isTrue();
        verify(queueRepo).save(any(QueueEntry.class));
    }

    @Test
    void enqueue_alreadyQueued_isNoOp() {
        UUID jobId = UUID.randomUUID();
        when(queueRepo.existsById(jobId)).thenReturn(true);

        assertThat(queue.enqueue(jobId)).isTrue();
        verify(queueRepo, never()).save(any());
    }

    // -------------------------------------------------------------------------
    // dequeue
    // -------------------------------------------------------------------------

    @Test
    void dequeue_leasesOldestVisibleEntry() {
        UUID jobId = UUID.randomUUID();
        QueueEntry entry = new QueueEntry(jobId, clock.instant());
        when(queueRepo.claimNextVisible(clock.instant())).thenReturn(Optional.of(entry));

        Optional<Delivery> delivery = queue.dequeue("worker-1", Duration.ZERO);

        assertThat(delivery).contains(new Delivery(jobId, "worker-1", 1));
        assertThat(entry.getWorkerId()).isEqualTo("worker-1");
        assertThat(entry.getVisibleAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(5)));
        verify(queueRepo).save(entry);
    }

    @Test
    void dequeue_emptyQueue_returnsEmptyAfterTimeout() {
        when(queueRepo.claimNextVisible(any())).thenReturn(Optional.empty());

        assertThat(queue.dequeue("worker-1", Duration.ZERO)).isEmpty();
    }

    @Test
    void redelivery_countsDeliveries() {
        UUID jobId = UUID.randomUUID();
        QueueEntry entry = new QueueEntry(jobId, clock.instant());
        entry.lease("worker-1", clock.instant(), clock.instant());
        entry.release(clock.instant());
        when(queueRepo.claimNextVisible(any())).thenReturn(Optional.of(entry));

        Delivery delivery = queue.dequeue("worker-2", Duration.ZERO).orElseThrow();

        assertThat(delivery.deliveries()).isEqualTo(2);
        assertThat(delivery.isRedelivery()).isTrue();
    }

    // -------------------------------------------------------------------------
    // ack / nack / renew
    // -------------------------------------------------------------------------

    @Test
    void ack_deletesEntry() {
        UUID jobId = UUID.randomUUID();
        QueueEntry entry = new QueueEntry(jobId, clock.instant());
        when(queueRepo.findByJobIdForUpdate(jobId)).thenReturn(Optional.of(entry));

        queue.ack(jobId);

        verify(queueRepo).delete(entry);
    }

    @Test
    void nack_makesEntryVisibleNow() {
        UUID jobId = UUID.randomUUID();
        QueueEntry entry = new QueueEntry(jobId, clock.instant());
        entry.lease("worker-1", clock.instant(), clock.instant().plus(Duration.ofMinutes(5)));
        when(queueRepo.findByJobIdForUpdate(jobId)).thenReturn(Optional.of(entry));

        queue.nack(jobId);

        assertThat(entry.getWorkerId()).isNull();
        assertThat(entry.getVisibleAt()).isEqualTo(clock.instant());
        verify(queueRepo).save(entry);
    }

    @Test
    void renewLease_ownLease_pushesVisibilityForward() {
        UUID jobId = UUID.randomUUID();
        QueueEntry entry = new QueueEntry(jobId, clock.instant());
        entry.lease("worker-1", clock.instant(), clock.instant().plus(Duration.ofMinutes(5)));
        when(queueRepo.findByJobIdForUpdate(jobId)).thenReturn(Optional.of(entry));
        clock.advance(Duration.ofMinutes(2));

        assertThat(queue.renewLease(jobId, "worker-1")).isTrue();
        assertThat(entry.getVisibleAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(5)));
    }

    @Test
    void renewLease_leaseTakenByOtherWorker_returnsFalse() {
        UUID jobId = UUID.randomUUID();
        QueueEntry entry = new QueueEntry(jobId, clock.instant());
        entry.lease("worker-2", clock.instant(), clock.instant());
        when(queueRepo.findByJobIdForUpdate(jobId)).thenReturn(Optional.of(entry));

        assertThat(queue.renewLease(jobId, "worker-1")).isFalse();
        verify(queueRepo, never()).save(any());
    }
}
