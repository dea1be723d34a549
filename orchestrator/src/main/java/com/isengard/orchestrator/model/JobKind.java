package com.isengard.orchestrator.model;

/** The two kinds of work the orchestrator runs. */
public enum JobKind {
    TRAINING,     // LoRA fine-tune through ai-toolkit
    GENERATION;   // image generation through the ComfyUI client

    public static JobKind fromParam(String value) {
        if (value == null || value.isBlank()) return null;
        return JobKind.valueOf(value.trim().toUpperCase());
    }
}
