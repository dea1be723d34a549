package com.isengard.orchestrator.storage;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * The filesystem area of one job: {@code logs/job.log}, {@code output/},
 * {@code samples/} and the {@code config.json} handed to the engine.
 *
 * An instance is a read-only view, safe for any number of concurrent
 * readers. Writing goes through a {@link Lease}, which only the job's
 * worker can hold (see {@link JobArenas#acquire}).
 */
public final class JobArena {

    private final UUID jobId;
    private final Path root;

    JobArena(UUID jobId, Path root) {
        this.jobId = jobId;
        this.root  = root;
    }

    public UUID jobId()      { return jobId; }
    public Path root()       { return root; }
    public Path logFile()    { return root.resolve("logs").resolve("job.log"); }
    public Path configFile() { return root.resolve("config.json"); }
    public Path outputDir()  { return root.resolve("output"); }
    public Path samplesDir() { return root.resolve("samples"); }

    public boolean exists() {
        return Files.isDirectory(root);
    }

    /** All lines of the job log; empty if the job never produced output. */
    public List<String> readLogLines() throws IOException {
        Path log = logFile();
        if (!Files.exists(log)) return List.of();
        return Files.readAllLines(log, StandardCharsets.UTF_8);
    }

    /** Regular files directly under {@code dir}, sorted by name. */
    public List<Path> listFiles(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile).sorted().toList();
        }
    }

    /**
     * Exclusive, writable handle on the arena. Closing it flushes the log
     * and hands the arena back to read-only use.
     */
    public static final class Lease implements AutoCloseable {

        private final JobArena       arena;
        private final Runnable       onRelease;
        private final BufferedWriter logWriter;
        private boolean closed;

        Lease(JobArena arena, Runnable onRelease) {
            this.arena     = arena;
            this.onRelease = onRelease;
            try {
                Files.createDirectories(arena.logFile().getParent());
                Files.createDirectories(arena.outputDir());
                Files.createDirectories(arena.samplesDir());
                this.logWriter = Files.newBufferedWriter(arena.logFile(), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                onRelease.run();
                throw new UncheckedIOException("Cannot prepare arena " + arena.root(), e);
            }
        }

        public JobArena arena() {
            return arena;
        }

        /** Append one line to the job log. Called from the reader thread and the runner. */
        public synchronized void appendLog(String line) {
            if (closed) return;
            try {
                logWriter.write(line);
                logWriter.newLine();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot write job log " + arena.logFile(), e);
            }
        }

        public synchronized void flush() {
            if (closed) return;
            try {
                logWriter.flush();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot flush job log " + arena.logFile(), e);
            }
        }

        public void writeConfig(String json) throws IOException {
            Files.writeString(arena.configFile(), json, StandardCharsets.UTF_8);
        }

        @Override
        public synchronized void close() {
            if (closed) return;
            closed = true;
            try {
                logWriter.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot close job log " + arena.logFile(), e);
            } finally {
                onRelease.run();
            }
        }
    }
}
