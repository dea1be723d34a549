package com.isengard.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Where the current progress value came from. */
public enum ProgressSource {
    STRUCTURED("structured"),
    LOG_DERIVED("log-derived");

    private final String wireName;

    ProgressSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
