package com.isengard.orchestrator.worker;

/**
 * The engine subprocess could not be started (missing binary, bad working
 * directory, unwritable config). Recorded on the job as {@code LaunchError}.
 */
public class LaunchException extends RuntimeException {

    public LaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
