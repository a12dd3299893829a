package com.phillippitts.sessionscribe.service.hydration;

import com.phillippitts.sessionscribe.domain.Burst;
import com.phillippitts.sessionscribe.domain.RecordingSession;
import com.phillippitts.sessionscribe.domain.SessionStatus;
import com.phillippitts.sessionscribe.domain.Track;
import com.phillippitts.sessionscribe.exception.HydrationException;
import com.phillippitts.sessionscribe.persistence.JournalRecordingStore;
import com.phillippitts.sessionscribe.service.ogg.OggOpusMuxer;
import com.phillippitts.sessionscribe.testutil.FakeAudioToolchain;
import com.phillippitts.sessionscribe.testutil.OpusFrames;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HydrationReconstructorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T20:00:00Z");
    private static final int HEADER = WavWriter.HEADER_SIZE;

    @TempDir
    Path tempDir;

    private JournalRecordingStore store;
    private FakeAudioToolchain tools;
    private HydrationReconstructor reconstructor;

    @BeforeEach
    void setUp() {
        store = new JournalRecordingStore(tempDir.resolve("journal.jsonl"));
        tools = new FakeAudioToolchain(100);
        reconstructor = new HydrationReconstructor(store, tools, tempDir, Duration.ofSeconds(300));
        store.insertSession(new RecordingSession("s1", "guild", "channel", T0, null, SessionStatus.ACTIVE));
    }

    @AfterEach
    void tearDown() throws IOException {
        store.close();
    }

    @Test
    void shouldPlaceBurstsAtWallClockOffsets() throws IOException {
        // Arrange: 1s of speech, 5s of silence, 1s of speech
        Track track = trackWithFile("alice", 100);
        closedBurst(track, T0, 0, 50);
        closedBurst(track, T0.plusSeconds(6), 50, 100);

        // Act
        HydrationReport report = reconstructor.hydrate("s1", false, true);

        // Assert
        TrackHydration result = report.tracks().get(0);
        assertThat(result.burstsWritten()).isEqualTo(2);
        assertThat(result.duration()).isEqualTo(Duration.ofSeconds(7));
        assertThat(report.mixFile()).isNull();

        byte[] wav = Files.readAllBytes(result.output());
        assertThat(wav).hasSize(HEADER + 7 * PcmFormat.BYTES_PER_SECOND);
        assertThat(wav[HEADER]).isEqualTo(FakeAudioToolchain.frameFill(0));
        assertThat(wav[HEADER + 3 * PcmFormat.BYTES_PER_SECOND]).isZero();
        assertThat(wav[HEADER + 6 * PcmFormat.BYTES_PER_SECOND]).isEqualTo(FakeAudioToolchain.frameFill(50));
    }

    @Test
    void shouldClampLongSilenceUnlessDisabled() {
        // Arrange
        reconstructor = new HydrationReconstructor(store, tools, tempDir, Duration.ofSeconds(2));
        Track track = trackWithFile("alice", 100);
        closedBurst(track, T0, 0, 50);
        closedBurst(track, T0.plusSeconds(6), 50, 100);

        // Act
        Duration clamped = reconstructor.hydrate("s1", false, true).tracks().get(0).duration();
        Duration unclamped = reconstructor.hydrate("s1", false, false).tracks().get(0).duration();

        // Assert
        assertThat(clamped).isEqualTo(Duration.ofSeconds(4));
        assertThat(unclamped).isEqualTo(Duration.ofSeconds(7));
    }

    @Test
    void shouldClampOffsetsBeyondDecodedAudio() {
        // Arrange
        Track track = trackWithFile("alice", 100);
        closedBurst(track, T0, 0, 150);
        closedBurst(track, T0.plusSeconds(10), 200, 250);

        // Act
        TrackHydration result = reconstructor.hydrate("s1", false, true).tracks().get(0);

        // Assert
        assertThat(result.burstsWritten()).isEqualTo(1);
        assertThat(result.duration()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void shouldUseDecodedEndForOpenBurst() {
        // Arrange
        Track track = trackWithFile("alice", 100);
        store.insertBurst(track.id(), T0, 25);

        // Act
        TrackHydration result = reconstructor.hydrate("s1", false, true).tracks().get(0);

        // Assert
        assertThat(result.duration()).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    void shouldMixAllHydratedTracksWhenRequested() {
        // Arrange
        Track alice = trackWithFile("alice", 100);
        Track bob = trackWithFile("bob", 100);
        closedBurst(alice, T0, 0, 100);
        closedBurst(bob, T0.plusSeconds(1), 0, 100);

        // Act
        HydrationReport report = reconstructor.hydrate("s1", true, true);

        // Assert
        assertThat(report.tracks()).hasSize(2);
        assertThat(report.mixFile()).isEqualTo(tempDir.resolve("s1").resolve("hydrated").resolve("session_mix.wav"));
        assertThat(tools.mixCalls()).containsExactly(
                report.tracks().stream().map(TrackHydration::output).toList());
    }

    @Test
    void shouldSkipTracksWithoutBurstsOrFiles() {
        // Arrange
        Track silent = trackWithFile("alice", 100);
        Track missing = store.insertTrack("s1", "bob", 1, tempDir.resolve("gone.ogg").toString(), T0);
        store.markFirstPacket(missing.id(), T0);
        closedBurst(missing, T0, 0, 10);
        Track good = trackWithFile("carol", 100);
        closedBurst(good, T0, 0, 10);

        // Act
        HydrationReport report = reconstructor.hydrate("s1", false, true);

        // Assert
        assertThat(silent.id()).isNotEqualTo(good.id());
        assertThat(report.tracks()).extracting(TrackHydration::speakerId).containsExactly("carol");
    }

    @Test
    void shouldLeaveNoTemporaryFilesBehind() throws IOException {
        // Arrange
        Track track = trackWithFile("alice", 100);
        closedBurst(track, T0, 0, 100);

        // Act
        HydrationReport report = reconstructor.hydrate("s1", false, true);

        // Assert
        try (var files = Files.list(report.outputDir())) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("alice_1.wav");
        }
    }

    @Test
    void shouldFailForUnknownSessionOrMissingTracks() {
        assertThatThrownBy(() -> reconstructor.hydrate("nope", false, true))
                .isInstanceOf(HydrationException.class)
                .hasMessageContaining("Session not found");
        assertThatThrownBy(() -> reconstructor.hydrate("s1", false, true))
                .isInstanceOf(HydrationException.class)
                .hasMessageContaining("No audio tracks");

        trackWithFile("alice", 100);
        assertThatThrownBy(() -> reconstructor.hydrate("s1", false, true))
                .isInstanceOf(HydrationException.class)
                .hasMessageContaining("No tracks were hydrated");
    }

    private Track trackWithFile(String speakerId, int frames) {
        Path file = tempDir.resolve("s1").resolve(speakerId + "_1.ogg");
        try {
            Files.createDirectories(file.getParent());
            try (OutputStream out = Files.newOutputStream(file)) {
                OggOpusMuxer muxer = new OggOpusMuxer(out, "test");
                for (int i = 0; i < frames; i++) {
                    muxer.writeFrame(OpusFrames.standard());
                }
                muxer.finish();
            }
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        Track track = store.insertTrack("s1", speakerId, 1, file.toString(), T0);
        store.markFirstPacket(track.id(), T0);
        return track;
    }

    private Burst closedBurst(Track track, Instant start, long startFrame, long endFrame) {
        Burst burst = store.insertBurst(track.id(), start, startFrame);
        store.closeBurst(burst.id(), start.plusMillis((endFrame - startFrame) * 20), endFrame);
        return burst;
    }
}
