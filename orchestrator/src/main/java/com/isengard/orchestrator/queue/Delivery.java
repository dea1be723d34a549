package com.isengard.orchestrator.queue;

import java.util.UUID;

/**
 * One hand-off of a job to a worker.
 *
 * @param deliveries how many times this job has been handed out, including this one;
 *                   greater than 1 means an earlier worker nacked it or lost its lease
 */
public record Delivery(UUID jobId, String workerId, int deliveries) {

    public boolean isRedelivery() {
        return deliveries > 1;
    }
}
