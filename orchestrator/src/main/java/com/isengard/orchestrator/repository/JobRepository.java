package com.isengard.orchestrator.repository;

import com.isengard.orchestrator.model.Job;
import com.isengard.orchestrator.model.JobKind;
import com.isengard.orchestrator.model.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the jobs table.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Load a job and lock its row until the surrounding transaction commits.
     *
     * Every JobStore mutation goes through this, so writes to one job are
     * serialised while writes to different jobs never contend.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    /** Full snapshot including the artifact list. */
    @EntityGraph(attributePaths = "artifacts")
    Optional<Job> findWithArtifactsById(UUID id);

    Page<Job> findByStatusIn(Collection<JobStatus> statuses, Pageable pageable);

    Page<Job> findByKindAndStatusIn(JobKind kind, Collection<JobStatus> statuses, Pageable pageable);
}
