package com.isengard.orchestrator.storage;

import com.isengard.orchestrator.config.OrchestratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobArenasTest {

    @TempDir Path root;

    private JobArenas arenas;
    private UUID      jobId;

    @BeforeEach
    void setUp() {
        OrchestratorProperties props = new OrchestratorProperties();
        props.getStorage().setRoot(root);
        arenas = new JobArenas(props);
        jobId  = UUID.randomUUID();
    }

    @Test
    void view_ofUnstartedJob_hasNoLog() throws IOException {
        JobArena arena = arenas.view(jobId);

        assertThat(arena.exists()).isFalse();
        assertThat(arena.root()).isEqualTo(root.toAbsolutePath().normalize().resolve("jobs").resolve(jobId.toString()));
        assertThat(arena.readLogLines()).isEmpty();
        assertThat(arena.listFiles(arena.outputDir())).isEmpty();
    }

    @Test
    void lease_createsLayoutAndAppendsLog() throws IOException {
        try (JobArena.Lease lease = arenas.acquire(jobId)) {
            lease.appendLog("first");
            lease.appendLog("second");
        }

        JobArena arena = arenas.view(jobId);
        assertThat(Files.isDirectory(arena.outputDir())).isTrue();
        assertThat(Files.isDirectory(arena.samplesDir())).isTrue();
        assertThat(arena.readLogLines()).containsExactly("first", "second");
    }

    @Test
    void secondLease_onSameJob_isRefused() {
        try (JobArena.Lease ignored = arenas.acquire(jobId)) {
            assertThat(arenas.isLeased(jobId)).isTrue();
            assertThatThrownBy(() -> arenas.acquire(jobId)).isInstanceOf(IllegalStateException.class);
        }
        assertThat(arenas.isLeased(jobId)).isFalse();
    }

    @Test
    void redelivery_appendsToExistingLog() throws IOException {
        try (JobArena.Lease lease = arenas.acquire(jobId)) {
            lease.appendLog("attempt 1");
        }
        try (JobArena.Lease lease = arenas.acquire(jobId)) {
            lease.appendLog("attempt 2");
        }

        assertThat(arenas.view(jobId).readLogLines()).containsExactly("attempt 1", "attempt 2");
    }

    @Test
    void listFiles_skipsDirectoriesAndSortsByName() throws IOException {
        try (JobArena.Lease lease = arenas.acquire(jobId)) {
            Path out = lease.arena().outputDir();
            Files.writeString(out.resolve("b.png"), "b");
            Files.writeString(out.resolve("a.png"), "a");
            Files.createDirectories(out.resolve("nested"));

            assertThat(lease.arena().listFiles(out))
                    .extracting(p -> p.getFileName().toString())
                    .containsExactly("a.png", "b.png");
        }
    }
}
