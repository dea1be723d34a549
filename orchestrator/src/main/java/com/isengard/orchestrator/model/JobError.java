package com.isengard.orchestrator.model;

/**
 * The user-visible part of a failure: a type tag plus a message.
 * Stack traces never go in here; they stay in the job log.
 */
public record JobError(String type, String message) {

    public static final String LAUNCH_ERROR    = "LaunchError";
    public static final String RUNTIME_FAILURE = "RuntimeFailure";
    public static final String WORKER_CRASH    = "WorkerCrash";

    public static JobError launch(String message)  { return new JobError(LAUNCH_ERROR, message); }
    public static JobError runtime(String message) { return new JobError(RUNTIME_FAILURE, message); }
    public static JobError crash(String message)   { return new JobError(WORKER_CRASH, message); }
}
