package com.isengard.orchestrator.queue;

import com.isengard.orchestrator.config.OrchestratorProperties;
import com.isengard.orchestrator.model.QueueEntry;
import com.isengard.orchestrator.repository.QueueEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable, at-least-once work queue backed by the job_queue table.
 *
 * The DB is the broker: dequeue is SELECT FOR UPDATE SKIP LOCKED plus a
 * visibility lease, ack deletes the row, nack makes it visible again.
 * A worker that dies without acking simply stops renewing its lease, and
 * the job becomes claimable again once the visibility timeout lapses.
 *
 * Ordering is FIFO by enqueue time, best effort: a redelivered job keeps
 * its original position, so it may run after jobs enqueued later.
 */
@Service
public class JobQueue {

    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);

    // How often dequeue() re-checks the table while waiting for work.
    private static final Duration POLL_STEP = Duration.ofMillis(200);

    private final QueueEntryRepository queueRepo;
    private final TransactionTemplate  tx;
    private final Clock                clock;
    private final Duration             visibilityTimeout;

    public JobQueue(QueueEntryRepository queueRepo,
                    TransactionTemplate tx,
                    Clock clock,
                    OrchestratorProperties props) {
        this.queueRepo         = queueRepo;
        this.tx                = tx;
        this.clock             = clock;
        this.visibilityTimeout = props.getQueue().getVisibilityTimeout();
    }

    /**
     * Put a job on the queue. Enqueuing a job that is already queued is a no-op.
     *
     * @return true once the entry is durably stored
     */
    public boolean enqueue(UUID jobId) {
        return Boolean.TRUE.equals(tx.execute(status -> {
            if (queueRepo.existsById(jobId)) {
                log.debug("Job {} already queued", jobId);
                return true;
            }
            queueRepo.save(new QueueEntry(jobId, clock.instant()));
            log.info("Enqueued job {}", jobId);
            return true;
        }));
    }

    /**
     * Claim the next visible job, waiting up to {@code timeout} for one to appear.
     *
     * @return the delivery, or empty if nothing became available in time
     */
    public Optional<Delivery> dequeue(String workerId, Duration timeout) {
        Instant deadline = clock.instant().plus(timeout);
        while (true) {
            Optional<Delivery> claimed = tryClaim(workerId);
            if (claimed.isPresent() || !clock.instant().isBefore(deadline)) {
                return claimed;
            }
            try {
                Thread.sleep(POLL_STEP.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
    }

    /** The job is done with (successfully or not); remove it for good. */
    public void ack(UUID jobId) {
        tx.executeWithoutResult(status -> {
            queueRepo.findByJobIdForUpdate(jobId).ifPresent(entry -> {
                queueRepo.delete(entry);
                log.debug("Acked job {}", jobId);
            });
        });
    }

    /** Give the job back for immediate redelivery. */
    public void nack(UUID jobId) {
        tx.executeWithoutResult(status -> {
            queueRepo.findByJobIdForUpdate(jobId).ifPresent(entry -> {
                entry.release(clock.instant());
                queueRepo.save(entry);
                log.warn("Nacked job {} (deliveries so far: {})", jobId, entry.getDeliveries());
            });
        });
    }

    /**
     * Extend the lease of a job this worker is still running.
     *
     * @return false if the lease was lost (entry gone or claimed by another worker)
     */
    public boolean renewLease(UUID jobId, String workerId) {
        return Boolean.TRUE.equals(tx.execute(status -> {
            Optional<QueueEntry> opt = queueRepo.findByJobIdForUpdate(jobId);
            if (opt.isEmpty() || !workerId.equals(opt.get().getWorkerId())) {
                return false;
            }
            QueueEntry entry = opt.get();
            entry.renew(clock.instant().plus(visibilityTimeout));
            queueRepo.save(entry);
            return true;
        }));
    }

    private Optional<Delivery> tryClaim(String workerId) {
        return tx.execute(status -> {
            Instant now = clock.instant();
            Optional<QueueEntry> opt = queueRepo.claimNextVisible(now);
            if (opt.isEmpty()) {
                return Optional.<Delivery>empty();
            }
            QueueEntry entry = opt.get();
            entry.lease(workerId, now, now.plus(visibilityTimeout));
            queueRepo.save(entry);
            log.info("Worker '{}' claimed job {} (delivery {})",
                    workerId, entry.getJobId(), entry.getDeliveries());
            return Optional.of(new Delivery(entry.getJobId(), workerId, entry.getDeliveries()));
        });
    }
}
