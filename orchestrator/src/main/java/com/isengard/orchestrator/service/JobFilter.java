package com.isengard.orchestrator.service;

import com.isengard.orchestrator.model.JobKind;
import com.isengard.orchestrator.model.StatusGroup;

/**
 * List query: status group, optional kind, and a page (newest first).
 */
public record JobFilter(StatusGroup group, JobKind kind, int page, int size) {

    public static final int MAX_PAGE_SIZE = 200;

    public JobFilter {
        if (group == null) group = StatusGroup.ALL;
        if (page < 0) page = 0;
        if (size <= 0) size = 50;
        if (size > MAX_PAGE_SIZE) size = MAX_PAGE_SIZE;
    }

    public static JobFilter ongoing() {
        return new JobFilter(StatusGroup.ONGOING, null, 0, MAX_PAGE_SIZE);
    }
}
