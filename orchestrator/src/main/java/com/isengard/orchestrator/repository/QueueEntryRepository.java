package com.isengard.orchestrator.repository;

import com.isengard.orchestrator.model.QueueEntry;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * The work queue table.
 */
public interface QueueEntryRepository extends JpaRepository<QueueEntry, UUID> {

    /**
     * Claim the oldest visible entry.
     *
     * PESSIMISTIC_WRITE with lock timeout -2 renders as
     * SELECT ... FOR UPDATE SKIP LOCKED on PostgreSQL: a row another worker
     * is claiming right now is skipped instead of waited on.
     *
     * Must run inside a @Transactional method; the caller pushes visible_at
     * forward before commit.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            SELECT e FROM QueueEntry e
            WHERE e.visibleAt <= :now
            ORDER BY e.enqueuedAt ASC
            LIMIT 1
            """)
    Optional<QueueEntry> claimNextVisible(@Param("now") Instant now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM QueueEntry e WHERE e.jobId = :jobId")
    Optional<QueueEntry> findByJobIdForUpdate(@Param("jobId") UUID jobId);
}
