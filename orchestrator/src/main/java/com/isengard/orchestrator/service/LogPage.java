package com.isengard.orchestrator.service;

import java.util.List;

/** One window of a job log. */
public record LogPage(List<String> lines, int offset, int limit, int totalLines, boolean hasMore) {}
