package com.isengard.orchestrator.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStatusTest {

    @Test
    void lifecycleEdges_matchWorkerStateMachine() {
        assertThat(JobStatus.PENDING.allowedNext()).containsExactlyInAnyOrder(JobStatus.QUEUED, JobStatus.CANCELLED);
        assertThat(JobStatus.QUEUED.allowedNext())
                .containsExactlyInAnyOrder(JobStatus.RUNNING, JobStatus.FAILED, JobStatus.CANCELLED);
        assertThat(JobStatus.RUNNING.allowedNext())
                .containsExactlyInAnyOrder(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED);
    }

    @ParameterizedTest
    @EnumSource(value = JobStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    void terminalStatuses_haveNoExits(JobStatus terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (JobStatus next : JobStatus.values()) {
            assertThat(terminal.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    void pending_cannotSkipToRunning() {
        assertThat(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING)).isFalse();
        assertThat(JobStatus.COMPLETED.canTransitionTo(JobStatus.RUNNING)).isFalse();
    }

    @Test
    void statusGroups_parseFromQueryParam() {
        assertThat(StatusGroup.fromParam("ongoing").statuses())
                .containsExactlyInAnyOrder(JobStatus.PENDING, JobStatus.QUEUED, JobStatus.RUNNING);
        assertThat(StatusGroup.fromParam("successful").statuses()).containsExactly(JobStatus.COMPLETED);
        assertThat(StatusGroup.fromParam(null)).isEqualTo(StatusGroup.ALL);
        assertThatThrownBy(() -> StatusGroup.fromParam("bogus")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void jobProgress_mergeNeverMovesStepBackwards() {
        JobProgress stored = new JobProgress(10, 100, 10.0, 0.5, null, null, ProgressSource.STRUCTURED);

        stored.mergeFrom(new JobProgress(8, 100, 8.0, 0.4, 1.5, 60L, ProgressSource.LOG_DERIVED));

        assertThat(stored.getCurrentStep()).isEqualTo(10);
        assertThat(stored.getPercent()).isEqualTo(10.0);
        assertThat(stored.getLoss()).isEqualTo(0.4);
    }

    @Test
    void jobConfig_isImmutableSnapshot() {
        Map<String, Object> submitted = new HashMap<>(Map.of("steps", 1000));
        JobConfig config = new JobConfig(submitted);

        submitted.put("steps", 5);

        assertThat(config.intValue("steps", 0)).isEqualTo(1000);
        assertThatThrownBy(() -> config.asMap().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }
}
