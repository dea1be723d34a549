package com.isengard.orchestrator.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.isengard.orchestrator.service.LogPage;

import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LogViewResponse(UUID jobId, List<String> lines, int offset, int limit,
                              int totalLines, boolean hasMore) {

    public static LogViewResponse from(UUID jobId, LogPage page) {
        return new LogViewResponse(jobId, page.lines(), page.offset(), page.limit(),
                page.totalLines(), page.hasMore());
    }
}
