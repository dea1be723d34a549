package com.isengard.orchestrator.service;

/** Result of a cancel request. All three are answered with 200. */
public enum CancelOutcome {
    /** The job was pending or queued and is now cancelled. */
    CANCELLED,
    /** The job is running; its worker has been told to stop the engine. */
    CANCELLING,
    /** Nothing to do: the job had already finished. */
    ALREADY_TERMINAL
}
