package com.isengard.orchestrator.events;

import com.isengard.orchestrator.MutableClock;
import com.isengard.orchestrator.config.OrchestratorProperties;
import com.isengard.orchestrator.model.JobStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEventBusTest {

    private final UUID jobId = UUID.randomUUID();

    private MutableClock        clock;
    private SimpleMeterRegistry meters;
    private InMemoryEventBus    bus;

    @BeforeEach
    void setUp() {
        OrchestratorProperties props = new OrchestratorProperties();
        props.getEvents().setBacklogSize(5);
        props.getEvents().setSubscriberBuffer(3);
        props.getEvents().setRetention(Duration.ofMinutes(10));
        clock  = MutableClock.atEpoch();
        meters = new SimpleMeterRegistry();
        bus    = new InMemoryEventBus(props, meters, clock);
    }

    private ProgressEvent publishLog(String line) {
        return bus.publish(jobId, ProgressEvent.log(jobId, line));
    }

    // -------------------------------------------------------------------------
    // sequencing
    // -------------------------------------------------------------------------

    @Test
    void publish_assignsIncreasingSequences() {
        assertThat(publishLog("a").sequence()).isEqualTo(1);
        assertThat(publishLog("b").sequence()).isEqualTo(2);
        assertThat(bus.lastSequence(jobId)).isEqualTo(2);
        assertThat(meters.counter("isengard.events.published").count()).isEqualTo(2.0);
    }

    @Test
    void open_seedsCounterForRestartedJob() {
        bus.open(jobId, 41);

        assertThat(publishLog("after restart").sequence()).isEqualTo(42);
    }

    @Test
    void open_neverMovesCounterBackwards() {
        bus.open(jobId, 10);
        bus.open(jobId, 3);

        assertThat(bus.lastSequence(jobId)).isEqualTo(10);
    }

    // -------------------------------------------------------------------------
    // replay
    // -------------------------------------------------------------------------

    @Test
    void subscribe_replaysEverythingAfterResumePoint() {
        publishLog("a");
        publishLog("b");
        publishLog("c");

        try (Subscription sub = bus.subscribe(jobId, 1)) {
            assertThat(sub.gapExceeded()).isFalse();
            assertThat(sub.replay()).extracting(ProgressEvent::sequence).containsExactly(2L, 3L);
            assertThat(sub.sequenceAtSubscribe()).isEqualTo(3);
        }
    }

    @Test
    void subscribe_beyondBacklog_reportsGap() {
        for (int i = 0; i < 8; i++) publishLog("line " + i);

        try (Subscription sub = bus.subscribe(jobId, 1)) {
            assertThat(sub.gapExceeded()).isTrue();
            assertThat(sub.replay()).isEmpty();
        }
    }

    @Test
    void subscribe_aheadOfChannel_reportsGap() {
        publishLog("a");

        try (Subscription sub = bus.subscribe(jobId, 99)) {
            assertThat(sub.gapExceeded()).isTrue();
        }
    }

    @Test
    void subscribe_withoutResume_getsLiveOnly() throws InterruptedException {
        publishLog("old");

        try (Subscription sub = bus.subscribe(jobId, EventBus.NO_RESUME)) {
            assertThat(sub.replay()).isEmpty();
            publishLog("new");
            ProgressEvent live = sub.poll(Duration.ofMillis(100));
            assertThat(live.message()).isEqualTo("new");
            assertThat(live.sequence()).isEqualTo(2);
        }
    }

    // -------------------------------------------------------------------------
    // slow subscribers
    // -------------------------------------------------------------------------

    @Test
    void slowSubscriber_overflowsWithoutBlockingPublisher() {
        try (Subscription sub = bus.subscribe(jobId, EventBus.NO_RESUME)) {
            for (int i = 0; i < 5; i++) publishLog("line " + i);

            assertThat(sub.overflowed()).isTrue();
            assertThat(bus.lastSequence(jobId)).isEqualTo(5);
            assertThat(meters.counter("isengard.events.dropped").count()).isEqualTo(1.0);
        }
    }

    // -------------------------------------------------------------------------
    // eviction
    // -------------------------------------------------------------------------

    @Test
    void eviction_dropsTerminalChannelAfterRetention() {
        bus.publish(jobId, ProgressEvent.complete(jobId, JobStatus.COMPLETED, null, null, "done"));

        bus.evictIdleChannels();
        assertThat(bus.channelCount()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(11));
        bus.evictIdleChannels();
        assertThat(bus.channelCount()).isZero();
    }

    @Test
    void eviction_keepsChannelWithSubscribers() {
        publishLog("a");
        try (Subscription ignored = bus.subscribe(jobId, EventBus.NO_RESUME)) {
            clock.advance(Duration.ofHours(1));
            bus.evictIdleChannels();
            assertThat(bus.channelCount()).isEqualTo(1);
        }
    }

    @Test
    void eviction_keepsQuietRunningChannelSoSequenceKeepsCounting() {
        bus.open(jobId, 0);
        for (int i = 0; i < 57; i++) publishLog("line " + i);

        clock.advance(Duration.ofMinutes(11));
        bus.evictIdleChannels();

        assertThat(bus.channelCount()).isEqualTo(1);
        assertThat(publishLog("still training").sequence()).isEqualTo(58);
    }

    @Test
    void eviction_keepsTerminalChannelWhileSubscribed() {
        bus.publish(jobId, ProgressEvent.complete(jobId, JobStatus.COMPLETED, null, null, "done"));
        try (Subscription ignored = bus.subscribe(jobId, 0)) {
            clock.advance(Duration.ofMinutes(11));
            bus.evictIdleChannels();
            assertThat(bus.channelCount()).isEqualTo(1);
        }
    }
}
