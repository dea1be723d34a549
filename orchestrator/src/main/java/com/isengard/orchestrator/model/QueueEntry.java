package com.isengard.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A job waiting in (or leased from) the work queue.
 *
 * A worker claims the oldest visible entry with SELECT FOR UPDATE SKIP LOCKED
 * and pushes visible_at forward by the visibility timeout. While it runs the
 * job it keeps renewing that lease; if the worker dies the lease lapses and
 * the entry becomes claimable again. ack() deletes the row.
 *
 * DB table: job_queue  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "job_queue")
public class QueueEntry {

    @Id
    @Column(name = "job_id")
    private UUID jobId;

    @Column(name = "enqueued_at", nullable = false, updatable = false)
    private Instant enqueuedAt;

    // The entry is claimable once visible_at <= now().
    @Column(name = "visible_at", nullable = false)
    private Instant visibleAt;

    @Column(nullable = false)
    private int deliveries = 0;

    // Null while the entry is waiting to be claimed.
    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "leased_at")
    private Instant leasedAt;

    protected QueueEntry() {}   // required by JPA

    public QueueEntry(UUID jobId, Instant now) {
        this.jobId      = jobId;
        this.enqueuedAt = now;
        this.visibleAt  = now;
    }

    public UUID    getJobId()      { return jobId; }
    public Instant getEnqueuedAt() { return enqueuedAt; }
    public Instant getVisibleAt()  { return visibleAt; }
    public int     getDeliveries() { return deliveries; }
    public String  getWorkerId()   { return workerId; }

    public void lease(String workerId, Instant now, Instant visibleAgainAt) {
        this.workerId  = workerId;
        this.leasedAt  = now;
        this.visibleAt = visibleAgainAt;
        this.deliveries++;
    }

    public void renew(Instant visibleAgainAt) {
        this.visibleAt = visibleAgainAt;
    }

    public void release(Instant now) {
        this.workerId  = null;
        this.leasedAt  = null;
        this.visibleAt = now;
    }
}
