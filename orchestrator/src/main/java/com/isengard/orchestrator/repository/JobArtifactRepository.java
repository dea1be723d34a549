package com.isengard.orchestrator.repository;

import com.isengard.orchestrator.model.JobArtifact;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface JobArtifactRepository extends JpaRepository<JobArtifact, UUID> {

    boolean existsByJobIdAndPath(UUID jobId, String path);

    List<JobArtifact> findByJobIdOrderByCreatedAtAsc(UUID jobId);
}
