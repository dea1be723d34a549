package com.isengard.orchestrator.worker;

import com.isengard.orchestrator.engine.EngineCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * A running engine subprocess with stdout and stderr merged into one stream.
 */
public final class EngineProcess {

    private static final Logger log = LoggerFactory.getLogger(EngineProcess.class);

    private static final Duration KILL_WAIT = Duration.ofSeconds(5);

    private final Process process;
    private final String  executable;

    private EngineProcess(Process process, String executable) {
        this.process    = process;
        this.executable = executable;
    }

    /**
     * @throws LaunchException if the operating system refuses to start the process
     */
    public static EngineProcess launch(EngineCommand command) {
        ProcessBuilder pb = new ProcessBuilder(command.argv())
                .directory(command.workingDirectory().toFile())
                .redirectErrorStream(true);
        pb.environment().putAll(command.environment());
        try {
            Process process = pb.start();
            log.info("Started '{}' as pid {}", command.executable(), process.pid());
            return new EngineProcess(process, command.executable());
        } catch (IOException e) {
            throw new LaunchException("Cannot start '" + command.executable() + "': " + e.getMessage(), e);
        }
    }

    public BufferedReader outputReader() {
        return new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
    }

    public long pid() {
        return process.pid();
    }

    public boolean waitFor(Duration timeout) throws InterruptedException {
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public int exitValue() {
        return process.exitValue();
    }

    /**
     * Two-phase stop: SIGTERM to the engine and its children, then SIGKILL
     * for anything still alive after {@code grace}. The grace window lets
     * the engine flush a partial checkpoint.
     */
    public void terminate(Duration grace) {
        if (!process.isAlive()) return;
        List<ProcessHandle> children = process.descendants().toList();
        log.info("Sending SIGTERM to '{}' (pid {}, {} child process(es))", executable, pid(), children.size());
        process.destroy();
        children.forEach(ProcessHandle::destroy);
        try {
            if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("'{}' (pid {}) still alive after {}; killing", executable, pid(), grace);
                process.destroyForcibly();
                process.waitFor(KILL_WAIT.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        } finally {
            children.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
        }
    }

    /** Unblock a reader stuck on output held open by an orphaned child. */
    public void closeOutput() {
        try {
            process.getInputStream().close();
        } catch (IOException e) {
            log.debug("Closing output of pid {} failed: {}", pid(), e.getMessage());
        }
    }
}
