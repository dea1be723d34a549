package com.isengard.orchestrator.worker;

import com.isengard.orchestrator.config.OrchestratorProperties;
import com.isengard.orchestrator.engine.ArtifactCheck;
import com.isengard.orchestrator.engine.EngineAdapter;
import com.isengard.orchestrator.engine.EngineCommand;
import com.isengard.orchestrator.engine.EngineRegistry;
import com.isengard.orchestrator.events.ArtifactRef;
import com.isengard.orchestrator.events.EventBus;
import com.isengard.orchestrator.events.ProgressEvent;
import com.isengard.orchestrator.model.ArtifactDraft;
import com.isengard.orchestrator.model.ArtifactKind;
import com.isengard.orchestrator.model.Job;
import com.isengard.orchestrator.model.JobError;
import com.isengard.orchestrator.model.JobStatus;
import com.isengard.orchestrator.progress.EngineLine;
import com.isengard.orchestrator.progress.OutputLineParser;
import com.isengard.orchestrator.progress.ProgressReconciler;
import com.isengard.orchestrator.progress.ProgressSnapshot;
import com.isengard.orchestrator.queue.Delivery;
import com.isengard.orchestrator.queue.JobQueue;
import com.isengard.orchestrator.service.InvalidTransitionException;
import com.isengard.orchestrator.service.JobStore;
import com.isengard.orchestrator.storage.JobArena;
import com.isengard.orchestrator.storage.JobArenas;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one delivered job from the queue to a terminal status.
 *
 * <pre>
 *   pending --[dequeued]--> queued --[engine launched]--> running
 *   running --[exit 0, artifacts present]--> completed
 *   running --[exit != 0, or artifacts missing]--> failed (RuntimeFailure)
 *   running --[cancel]--> cancelled
 *   queued  --[launch error]--> failed (LaunchError)
 * </pre>
 *
 * The engine is launched before the job is marked RUNNING, so a job whose
 * engine cannot start never shows as running. If the job was cancelled
 * between launch and that transition, the engine is stopped again.
 *
 * Threads per job: the caller's thread supervises (cancel flag, lease
 * renewal, coalesced progress writes) and a reader thread blocks on engine
 * output. Neither ever waits on a stream subscriber.
 */
@Component
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    // How often the supervisor looks at the cancel flag while the engine is silent.
    private static final Duration SUPERVISE_TICK = Duration.ofMillis(250);

    // How long to wait for the reader to drain output after the engine exits.
    private static final Duration READER_DRAIN = Duration.ofSeconds(5);

    // Lines of output kept for the RuntimeFailure message.
    private static final int OUTPUT_TAIL_LINES = 20;

    private final JobStore               store;
    private final JobQueue               queue;
    private final EventBus               bus;
    private final EngineRegistry         engines;
    private final JobArenas              arenas;
    private final OutputLineParser       parser;
    private final MeterRegistry          meterRegistry;
    private final Clock                  clock;
    private final OrchestratorProperties props;

    private final Map<UUID, RunHandle> active = new ConcurrentHashMap<>();

    public JobRunner(JobStore store,
                     JobQueue queue,
                     EventBus bus,
                     EngineRegistry engines,
                     JobArenas arenas,
                     OutputLineParser parser,
                     MeterRegistry meterRegistry,
                     Clock clock,
                     OrchestratorProperties props) {
        this.store         = store;
        this.queue         = queue;
        this.bus           = bus;
        this.engines       = engines;
        this.arenas        = arenas;
        this.parser        = parser;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.props         = props;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Run a delivery to completion. Always leaves the queue entry acked,
     * except when the worker itself fails or shuts down mid-run, in which
     * case the entry is nacked for redelivery.
     */
    public void run(Delivery delivery) {
        UUID jobId = delivery.jobId();
        MDC.put("jobId", jobId.toString());
        MDC.put("workerId", delivery.workerId());
        MDC.put("attempt", String.valueOf(delivery.deliveries()));
        try {
            Optional<Job> found = store.find(jobId);
            if (found.isEmpty()) {
                log.warn("Dequeued unknown job {}; dropping queue entry", jobId);
                queue.ack(jobId);
                return;
            }
            Job job = found.get();
            MDC.put("kind", job.getKind().name().toLowerCase(Locale.ROOT));

            if (job.isTerminal()) {
                log.info("Job {} is already {}; nothing to run", jobId, job.getStatus());
                queue.ack(jobId);
                return;
            }
            store.recordDelivery(jobId, delivery.deliveries());
            if (delivery.deliveries() > props.getQueue().getMaxDeliveries()) {
                giveUp(job, delivery);
                return;
            }
            execute(job, delivery);
        } catch (InvalidTransitionException e) {
            log.warn("Job {} changed status underneath the worker: {}", jobId, e.getMessage());
            queue.ack(jobId);
        } catch (RuntimeException e) {
            log.error("Unhandled error while running job {}: {}", jobId, e.getMessage(), e);
            queue.nack(jobId);
        } finally {
            MDC.clear();
        }
    }

    /**
     * Ask the run of {@code jobId} on this node to stop. The supervisor sees
     * the flag within one tick even if the engine prints nothing.
     *
     * @return false if this node is not running the job
     */
    public boolean cancel(UUID jobId) {
        RunHandle handle = active.get(jobId);
        if (handle == null) return false;
        handle.requestCancel();
        log.info("Cancellation requested for job {}", jobId);
        return true;
    }

    public boolean isRunning(UUID jobId) {
        return active.containsKey(jobId);
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    private void giveUp(Job job, Delivery delivery) {
        UUID jobId = job.getId();
        log.error("Job {} delivered {} times (max {}); marking failed",
                jobId, delivery.deliveries(), props.getQueue().getMaxDeliveries());
        bus.open(jobId, job.getLastSequence());
        JobError error = JobError.crash("Worker stopped unexpectedly "
                + (delivery.deliveries() - 1) + " time(s) while running this job");
        if (job.getStatus() == JobStatus.PENDING) {
            store.updateStatus(jobId, JobStatus.QUEUED);
        }
        store.updateStatus(jobId, JobStatus.FAILED, error);
        publishComplete(jobId, JobStatus.FAILED, null, error, "Job failed: worker crashed repeatedly");
        queue.ack(jobId);
    }

    private void execute(Job job, Delivery delivery) {
        UUID jobId = job.getId();
        EngineAdapter engine = engines.forKind(job.getKind());
        boolean resumed = job.getStatus() == JobStatus.RUNNING;
        bus.open(jobId, job.getLastSequence());

        RunHandle handle = new RunHandle();
        if (active.putIfAbsent(jobId, handle) != null) {
            log.warn("Job {} is already running on this node; leaving delivery to its lease", jobId);
            return;
        }
        Instant started = clock.instant();
        try (JobArena.Lease lease = arenas.acquire(jobId)) {
            if (job.getStatus() == JobStatus.PENDING) {
                store.updateStatus(jobId, JobStatus.QUEUED);
                bus.publish(jobId, ProgressEvent.status(jobId, JobStatus.QUEUED, "initializing",
                        "Preparing " + engine.backend()));
            }
            lease.appendLog("=== delivery " + delivery.deliveries() + " on " + delivery.workerId()
                    + " at " + started + " ===");

            EngineProcess process;
            try {
                EngineCommand command = engine.prepare(job, lease);
                log.info("Launching {} for job {}: {}", engine.backend(), jobId, command.argv());
                process = EngineProcess.launch(command);
            } catch (LaunchException | IOException e) {
                failLaunch(jobId, lease, e);
                record(job, JobStatus.FAILED, started);
                return;
            }

            if (handle.cancelRequested()) {
                stopBeforeStart(jobId, lease, process, "Cancelled before the engine started");
                store.updateStatus(jobId, JobStatus.CANCELLED);
                publishComplete(jobId, JobStatus.CANCELLED, null, null, "Job cancelled");
                queue.ack(jobId);
                record(job, JobStatus.CANCELLED, started);
                return;
            }
            if (!resumed) {
                try {
                    store.updateStatus(jobId, JobStatus.RUNNING);
                } catch (InvalidTransitionException e) {
                    stopBeforeStart(jobId, lease, process, "Job left the queue before the engine started");
                    queue.ack(jobId);
                    return;
                }
            }
            bus.publish(jobId, ProgressEvent.status(jobId, JobStatus.RUNNING, engine.runningStage(),
                    resumed ? "Resumed " + engine.backend() + " after a worker restart"
                            : "Started " + engine.backend()));

            JobStatus outcome = supervise(job, engine, delivery, lease, process, handle);
            if (outcome != null) {
                record(job, outcome, started);
            }
        } finally {
            active.remove(jobId);
        }
    }

    private void failLaunch(UUID jobId, JobArena.Lease lease, Exception e) {
        String message = e.getMessage();
        log.error("Could not launch engine for job {}: {}", jobId, message, e);
        lease.appendLog("Launch failed: " + message);
        JobError error = JobError.launch(message);
        store.updateStatus(jobId, JobStatus.FAILED, error);
        publishComplete(jobId, JobStatus.FAILED, null, error, "Engine could not be started");
        queue.ack(jobId);
    }

    private void stopBeforeStart(UUID jobId, JobArena.Lease lease, EngineProcess process, String reason) {
        log.info("Job {}: {}; stopping engine", jobId, reason);
        lease.appendLog(reason);
        process.terminate(props.getWorker().getGraceKillTimeout());
    }

    /**
     * Watch the engine until it exits or the job is cancelled, then settle
     * the job.
     *
     * @return the terminal status reached, or null if the run was abandoned for
     *         redelivery or because another node already settled the job
     */
    private JobStatus supervise(Job job, EngineAdapter engine, Delivery delivery,
                                JobArena.Lease lease, EngineProcess process, RunHandle handle) {
        UUID jobId = job.getId();
        Duration grace = props.getWorker().getGraceKillTimeout();

        ProgressReconciler reconciler = new ProgressReconciler(
                job.getProgress().getTotalSteps(),
                props.getProgress().getStalenessWindow(),
                props.getProgress().getSmoothing(),
                clock);
        reconciler.resumeAt(job.getProgress().getCurrentStep(), job.getProgress().getSource());

        OutputHandler output = new OutputHandler(jobId, engine.runningStage(), reconciler, lease);
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Thread reader = new Thread(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            output.drain(process);
        }, "engine-reader-" + jobId.toString().substring(0, 8));
        reader.setDaemon(true);
        reader.start();

        Duration persistEvery = props.getWorker().getPersistInterval();
        Duration renewEvery   = props.getQueue().getVisibilityTimeout().dividedBy(3);
        Instant  nextPersist  = clock.instant().plus(persistEvery);
        Instant  nextRenew    = clock.instant().plus(renewEvery);
        boolean  cancelled    = false;
        boolean  abandoned    = false;

        try {
            while (!process.waitFor(SUPERVISE_TICK)) {
                if (handle.cancelRequested()) {
                    lease.appendLog("Cancellation requested; stopping engine");
                    process.terminate(grace);
                    cancelled = true;
                    break;
                }
                Instant now = clock.instant();
                if (!now.isBefore(nextRenew)) {
                    if (!queue.renewLease(jobId, delivery.workerId())) {
                        if (settledElsewhere(jobId)) {
                            lease.appendLog("Job was settled by another node; stopping engine");
                            process.terminate(grace);
                            abandoned = true;
                            break;
                        }
                        log.warn("Lost the queue lease on job {}; it may be redelivered", jobId);
                    }
                    nextRenew = now.plus(renewEvery);
                }
                if (!now.isBefore(nextPersist)) {
                    output.persist();
                    nextPersist = now.plus(persistEvery);
                }
            }
            reader.join(READER_DRAIN.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted while running job {}; stopping engine for redelivery", jobId);
            process.terminate(grace);
            output.persist();
            queue.nack(jobId);
            return null;
        }
        if (reader.isAlive()) {
            log.warn("Engine output of job {} still open after exit; closing it", jobId);
            process.closeOutput();
        }
        output.stop();
        if (abandoned) {
            log.info("Job {} was settled elsewhere; engine stopped, nothing left to record", jobId);
            lease.flush();
            return null;
        }
        output.persist();
        lease.flush();

        ProgressSnapshot last = output.current();
        JobStatus outcome;
        if (cancelled) {
            store.updateStatus(jobId, JobStatus.CANCELLED);
            publishComplete(jobId, JobStatus.CANCELLED, last, null, "Job cancelled");
            outcome = JobStatus.CANCELLED;
        } else if (process.exitValue() == 0) {
            outcome = settleCleanExit(job, engine, lease, output, last);
        } else {
            int code = process.exitValue();
            String tail = output.tail();
            log.warn("Engine for job {} exited with code {}", jobId, code);
            JobError error = JobError.runtime("Engine exited with code " + code
                    + (tail.isEmpty() ? "" : ": " + tail));
            store.updateStatus(jobId, JobStatus.FAILED, error);
            publishComplete(jobId, JobStatus.FAILED, last, error, "Job failed");
            outcome = JobStatus.FAILED;
        }
        queue.ack(jobId);
        return outcome;
    }

    /** True when the job is gone or terminal, e.g. cancelled through an API-only node. */
    private boolean settledElsewhere(UUID jobId) {
        return store.find(jobId).map(Job::isTerminal).orElse(true);
    }

    private JobStatus settleCleanExit(Job job, EngineAdapter engine, JobArena.Lease lease,
                                      OutputHandler output, ProgressSnapshot last) {
        UUID jobId = job.getId();
        ArtifactCheck check;
        try {
            check = engine.collectArtifacts(job, lease.arena());
        } catch (IOException e) {
            log.error("Could not scan artifacts of job {}: {}", jobId, e.getMessage(), e);
            check = ArtifactCheck.incomplete(List.of(), "artifact scan failed: " + e.getMessage());
        }
        check.found().forEach(output::recordArtifact);

        if (!check.ok()) {
            JobError error = JobError.runtime("Engine exited 0 but " + check.problem());
            lease.appendLog(error.message());
            store.updateStatus(jobId, JobStatus.FAILED, error);
            publishComplete(jobId, JobStatus.FAILED, last, error, "Job failed");
            return JobStatus.FAILED;
        }
        store.updateStatus(jobId, JobStatus.COMPLETED);
        publishComplete(jobId, JobStatus.COMPLETED, last.finished(), null, "Job completed");
        return JobStatus.COMPLETED;
    }

    private void publishComplete(UUID jobId, JobStatus status, ProgressSnapshot snapshot,
                                 JobError error, String message) {
        ProgressEvent event = bus.publish(jobId, ProgressEvent.complete(jobId, status, snapshot, error, message));
        store.recordSequence(jobId, event.sequence());
    }

    private void record(Job job, JobStatus status, Instant started) {
        meterRegistry.timer("isengard.jobs.duration",
                        "kind", job.getKind().name().toLowerCase(Locale.ROOT),
                        "status", status.wireName())
                .record(Duration.between(started, clock.instant()));
    }

    // ------------------------------------------------------------------
    // Per-run state
    // ------------------------------------------------------------------

    private static final class RunHandle {
        private volatile boolean cancelRequested;

        void requestCancel()      { cancelRequested = true; }
        boolean cancelRequested() { return cancelRequested; }
    }

    /**
     * Reader-side processing of engine output. Everything except
     * {@link #persist}, {@link #tail} and {@link #stop} runs on the reader thread.
     */
    private final class OutputHandler {

        private final UUID               jobId;
        private final String             stage;
        private final ProgressReconciler reconciler;
        private final JobArena.Lease     lease;

        private final Deque<String> tail = new ArrayDeque<>();
        private final AtomicReference<ProgressSnapshot> unsaved = new AtomicReference<>();
        private volatile ProgressSnapshot current;
        private boolean stopped;

        OutputHandler(UUID jobId, String stage, ProgressReconciler reconciler, JobArena.Lease lease) {
            this.jobId      = jobId;
            this.stage      = stage;
            this.reconciler = reconciler;
            this.lease      = lease;
            this.current    = reconciler.current();
        }

        void drain(EngineProcess process) {
            try (BufferedReader reader = process.outputReader()) {
                String line;
                while ((line = reader.readLine()) != null) {
                    lease.appendLog(line);
                    remember(line);
                    if (!accept(line)) break;
                }
            } catch (IOException e) {
                log.debug("Engine output of job {} closed: {}", jobId, e.getMessage());
            }
        }

        /** @return false once the run has been settled and output is no longer wanted */
        private synchronized boolean accept(String line) {
            if (stopped) return false;
            try {
                handle(line);
            } catch (RuntimeException e) {
                log.warn("Skipping engine line for job {}: {}", jobId, e.toString());
            }
            return true;
        }

        /** No event is published for this run after this returns. */
        synchronized void stop() {
            stopped = true;
        }

        private void handle(String raw) {
            EngineLine line = parser.parse(raw);
            Optional<ProgressSnapshot> update = reconciler.accept(line);
            if (update.isPresent()) {
                current = update.get();
                unsaved.set(current);
                String message = line.kind() == EngineLine.Kind.STRUCTURED ? line.message() : null;
                bus.publish(jobId, ProgressEvent.progress(jobId, stage, current, line.gpu(), message));
            } else if (line.gpu() != null) {
                bus.publish(jobId, ProgressEvent.progress(jobId, stage, current, line.gpu(), line.message()));
            } else if (line.kind() != EngineLine.Kind.STRUCTURED) {
                bus.publish(jobId, ProgressEvent.log(jobId, raw));
            } else if (line.message() != null) {
                bus.publish(jobId, ProgressEvent.log(jobId, line.message()));
            }

            Integer step = line.step();
            if (line.samplePath() != null) {
                recordArtifact(draft(line.samplePath(), ArtifactKind.SAMPLE, step));
            }
            if (line.checkpointPath() != null) {
                recordArtifact(draft(line.checkpointPath(), ArtifactKind.CHECKPOINT, step));
            }
        }

        void recordArtifact(ArtifactDraft draft) {
            if (store.appendArtifact(jobId, draft)) {
                bus.publish(jobId, ProgressEvent.artifact(jobId,
                        new ArtifactRef(draft.name(), draft.path(), draft.kind(), draft.step())));
            }
        }

        /** Write the latest unsaved reading, if any. Called by the supervisor. */
        void persist() {
            ProgressSnapshot snapshot = unsaved.getAndSet(null);
            if (snapshot != null) {
                store.updateProgress(jobId, snapshot.toJobProgress(), bus.lastSequence(jobId));
            }
        }

        ProgressSnapshot current() {
            return current;
        }

        private void remember(String line) {
            synchronized (tail) {
                if (tail.size() == OUTPUT_TAIL_LINES) tail.removeFirst();
                tail.addLast(line);
            }
        }

        String tail() {
            synchronized (tail) {
                return String.join("\n", tail).trim();
            }
        }

        private ArtifactDraft draft(String path, ArtifactKind kind, Integer step) {
            Path file = Path.of(path);
            Path name = file.getFileName();
            return new ArtifactDraft(name == null ? path : name.toString(), path, kind, step);
        }
    }
}
