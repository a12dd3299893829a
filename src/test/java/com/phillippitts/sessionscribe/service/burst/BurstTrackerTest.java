package com.phillippitts.sessionscribe.service.burst;

import com.phillippitts.sessionscribe.config.properties.RecordingProperties;
import com.phillippitts.sessionscribe.domain.Burst;
import com.phillippitts.sessionscribe.persistence.JournalRecordingStore;
import com.phillippitts.sessionscribe.service.recorder.TrackRecorder;
import com.phillippitts.sessionscribe.service.voice.SpeakingListener;
import com.phillippitts.sessionscribe.testutil.FakeVoiceTransport;
import com.phillippitts.sessionscribe.testutil.ManualTaskScheduler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BurstTrackerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T20:00:00Z");
    private static final Duration MAX_BURST = Duration.ofMinutes(10);

    @TempDir
    Path tempDir;

    private ManualTaskScheduler scheduler;
    private JournalRecordingStore store;
    private FakeVoiceTransport transport;
    private TrackRecorder recorder;
    private BurstTracker tracker;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler(T0);
        store = new JournalRecordingStore(tempDir.resolve("journal.jsonl"));
        transport = new FakeVoiceTransport();
        RecordingProperties props = new RecordingProperties();
        props.setDataDir(tempDir.resolve("sessions").toString());
        recorder = new TrackRecorder("s1", transport, store, null, props, scheduler.getClock(),
                new SimpleMeterRegistry(), null);
        tracker = new BurstTracker("s1", recorder, store, transport.speakingSignals(), scheduler, MAX_BURST);
    }

    @AfterEach
    void tearDown() throws IOException {
        tracker.destroy();
        recorder.closeAll();
        store.close();
    }

    @Test
    void shouldRecordBurstWithFrameOffsetsFromTrack() {
        // Arrange
        recorder.subscribe("alice");
        transport.sendFrames("alice", 50);

        // Act
        transport.speakingSignals().speakingStarted("alice");
        transport.sendFrames("alice", 100);
        scheduler.advance(Duration.ofSeconds(2));
        transport.speakingSignals().speakingEnded("alice");

        // Assert
        List<Burst> bursts = store.getTrackBursts(recorder.currentTrackId("alice"));
        assertThat(bursts).hasSize(1);
        Burst burst = bursts.get(0);
        assertThat(burst.startFrameOffset()).isEqualTo(50);
        assertThat(burst.endFrameOffset()).isEqualTo(150L);
        assertThat(burst.startedAt()).isEqualTo(T0);
        assertThat(burst.endedAt()).isEqualTo(T0.plusSeconds(2));
        assertThat(tracker.isOpen("alice")).isFalse();
    }

    @Test
    void shouldIgnoreRepeatedSpeakingStart() {
        // Arrange
        recorder.subscribe("alice");
        transport.speakingSignals().speakingStarted("alice");
        transport.sendFrames("alice", 10);

        // Act
        transport.speakingSignals().speakingStarted("alice");

        // Assert
        assertThat(store.getTrackBursts(recorder.currentTrackId("alice"))).hasSize(1);
        assertThat(tracker.openCount()).isEqualTo(1);
    }

    @Test
    void shouldNotOpenBurstWithoutTrack() {
        // Act
        transport.speakingSignals().speakingStarted("ghost");
        transport.speakingSignals().speakingEnded("ghost");

        // Assert
        assertThat(tracker.openCount()).isZero();
    }

    @Test
    void shouldSplitBurstAtMaximumDurationWithoutGap() {
        // Arrange
        recorder.subscribe("alice");
        transport.speakingSignals().speakingStarted("alice");
        transport.sendFrames("alice", 30);

        // Act
        scheduler.advance(MAX_BURST);
        transport.sendFrames("alice", 20);
        scheduler.advance(Duration.ofSeconds(1));
        transport.speakingSignals().speakingEnded("alice");

        // Assert
        List<Burst> bursts = store.getTrackBursts(recorder.currentTrackId("alice"));
        assertThat(bursts).hasSize(2);
        assertThat(bursts.get(0).endFrameOffset()).isEqualTo(30L);
        assertThat(bursts.get(0).endedAt()).isEqualTo(T0.plus(MAX_BURST));
        assertThat(bursts.get(1).startFrameOffset()).isEqualTo(30);
        assertThat(bursts.get(1).startedAt()).isEqualTo(bursts.get(0).endedAt());
        assertThat(bursts.get(1).endFrameOffset()).isEqualTo(50L);
    }

    @Test
    void shouldCancelWatchdogWhenBurstEnds() {
        // Arrange
        recorder.subscribe("alice");
        transport.speakingSignals().speakingStarted("alice");

        // Act
        transport.speakingSignals().speakingEnded("alice");
        scheduler.advance(MAX_BURST.plusMinutes(1));

        // Assert
        assertThat(store.getTrackBursts(recorder.currentTrackId("alice"))).hasSize(1);
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void shouldUseStartOffsetWhenTrackClosedFirst() {
        // Arrange
        recorder.subscribe("alice");
        transport.sendFrames("alice", 5);
        transport.speakingSignals().speakingStarted("alice");
        transport.sendFrames("alice", 5);
        long trackId = recorder.currentTrackId("alice");

        // Act
        recorder.close("alice");
        tracker.closeUserBurst("alice");

        // Assert
        Burst burst = store.getTrackBursts(trackId).get(0);
        assertThat(burst.endFrameOffset()).isEqualTo(5L);
    }

    @Test
    void shouldCloseAllBurstsAndDetachOnlyItselfOnDestroy() {
        // Arrange
        List<String> otherListenerEdges = new ArrayList<>();
        transport.speakingSignals().subscribe(new SpeakingListener() {
            @Override
            public void onSpeakingStart(String speakerId) {
                otherListenerEdges.add("start:" + speakerId);
            }

            @Override
            public void onSpeakingEnd(String speakerId) {
                otherListenerEdges.add("end:" + speakerId);
            }
        });
        recorder.subscribe("alice");
        recorder.subscribe("bob");
        transport.speakingSignals().speakingStarted("alice");
        transport.speakingSignals().speakingStarted("bob");

        // Act
        tracker.destroy();
        tracker.destroy();
        transport.speakingSignals().speakingStarted("alice");

        // Assert
        assertThat(tracker.openCount()).isZero();
        assertThat(store.getTrackBursts(recorder.currentTrackId("alice"))).hasSize(1)
                .allSatisfy(b -> assertThat(b.isOpen()).isFalse());
        assertThat(store.getTrackBursts(recorder.currentTrackId("bob"))).hasSize(1)
                .allSatisfy(b -> assertThat(b.isOpen()).isFalse());
        assertThat(otherListenerEdges).containsExactly("start:alice", "start:bob", "start:alice");
    }
}
