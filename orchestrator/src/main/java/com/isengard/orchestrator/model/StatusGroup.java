package com.isengard.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Named sets of statuses used by list filters.
 *
 * "What is running right now" is always answered by querying ONGOING,
 * never by caching a current-job reference.
 */
public enum StatusGroup {
    ONGOING(EnumSet.of(JobStatus.PENDING, JobStatus.QUEUED, JobStatus.RUNNING)),
    SUCCESSFUL(EnumSet.of(JobStatus.COMPLETED)),
    FINISHED(EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED)),
    ALL(EnumSet.allOf(JobStatus.class));

    private final Set<JobStatus> statuses;

    StatusGroup(Set<JobStatus> statuses) {
        this.statuses = statuses;
    }

    public Set<JobStatus> statuses() {
        return statuses;
    }

    public static StatusGroup fromParam(String value) {
        if (value == null || value.isBlank()) return ALL;
        return StatusGroup.valueOf(value.trim().toUpperCase());
    }
}
