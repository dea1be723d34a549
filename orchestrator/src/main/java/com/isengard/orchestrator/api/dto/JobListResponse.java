package com.isengard.orchestrator.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.isengard.orchestrator.model.Job;
import org.springframework.data.domain.Page;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobListResponse(List<JobResponse> jobs, int page, int size, long total, boolean hasMore) {

    public static JobListResponse from(Page<Job> page) {
        return new JobListResponse(
                page.getContent().stream().map(JobResponse::summary).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.hasNext());
    }
}
