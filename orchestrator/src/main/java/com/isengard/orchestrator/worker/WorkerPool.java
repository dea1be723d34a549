package com.isengard.orchestrator.worker;

import com.isengard.orchestrator.config.OrchestratorProperties;
import com.isengard.orchestrator.queue.JobQueue;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * N worker slots, each owning at most one engine subprocess at a time.
 *
 * The DB is the queue: every slot loops on {@link JobQueue#dequeue} and runs
 * whatever it claims to completion before asking for more. The pool size is
 * therefore the system-wide cap on concurrently running jobs for this node.
 */
@Component
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final JobQueue               queue;
    private final JobRunner              runner;
    private final OrchestratorProperties props;
    private final String                 nodeId = "node-" + UUID.randomUUID().toString().substring(0, 8);
    private final AtomicBoolean          running = new AtomicBoolean();

    private ExecutorService slots;

    public WorkerPool(JobQueue queue, JobRunner runner, OrchestratorProperties props) {
        this.queue  = queue;
        this.runner = runner;
        this.props  = props;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!props.getWorker().isEnabled()) {
            log.info("Worker pool disabled (isengard.worker.enabled=false)");
            return;
        }
        if (!running.compareAndSet(false, true)) return;

        int size = props.getWorker().getPoolSize();
        AtomicInteger counter = new AtomicInteger();
        slots = Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 1; i <= size; i++) {
            String workerId = nodeId + "-" + i;
            slots.submit(() -> slotLoop(workerId));
        }
        log.info("Worker pool started: {} slot(s) on {}", size, nodeId);
    }

    /** See {@link JobRunner#cancel}. */
    public boolean cancel(UUID jobId) {
        return runner.cancel(jobId);
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) return;
        slots.shutdown();
        Duration grace = props.getWorker().getGraceKillTimeout().plus(props.getWorker().getPollInterval());
        try {
            if (!slots.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker slots still busy after {}; interrupting running jobs", grace);
                slots.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            slots.shutdownNow();
        }
        log.info("Worker pool stopped");
    }

    private void slotLoop(String workerId) {
        Duration poll = props.getWorker().getPollInterval();
        log.info("Worker slot '{}' started", workerId);
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                queue.dequeue(workerId, poll).ifPresent(runner::run);
            } catch (RuntimeException e) {
                log.error("Worker slot '{}' could not dequeue: {}", workerId, e.getMessage(), e);
                pause(poll);
            }
        }
        log.info("Worker slot '{}' stopped", workerId);
    }

    private static void pause(Duration d) {
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
