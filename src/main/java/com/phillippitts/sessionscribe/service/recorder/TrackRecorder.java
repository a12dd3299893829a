package com.phillippitts.sessionscribe.service.recorder;

import com.phillippitts.sessionscribe.config.properties.RecordingProperties;
import com.phillippitts.sessionscribe.domain.SessionSpeakerKey;
import com.phillippitts.sessionscribe.domain.Track;
import com.phillippitts.sessionscribe.exception.SessionScribeException;
import com.phillippitts.sessionscribe.persistence.RecordingStore;
import com.phillippitts.sessionscribe.service.ogg.OggOpusMuxer;
import com.phillippitts.sessionscribe.service.resampler.ResamplerProcess;
import com.phillippitts.sessionscribe.service.resampler.ResamplerRegistry;
import com.phillippitts.sessionscribe.service.voice.AudioSubscription;
import com.phillippitts.sessionscribe.service.voice.VoiceTransport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Records each speaker of one session into its own Ogg/Opus file.
 *
 * <p>One {@link ActiveTrack} exists per speaker while subscribed. A speaker who leaves and rejoins
 * gets a new file ({@code {speakerId}_{n}.ogg}) and a new track record.
 *
 * <p><b>Frame counter:</b> incremented once per packet written, under the track lock. Burst
 * boundaries are read through {@link #position(String)} under the same lock, so an offset never
 * lands between a write and its increment.
 *
 * <p><b>Frame duration:</b> every packet is assumed to last 20 ms. Packets that don't are still
 * written, and a throttled warning plus {@link NonStandardFrameEvent} flags the drift.
 */
public class TrackRecorder {

    private static final Logger LOG = LogManager.getLogger(TrackRecorder.class);

    private final String sessionId;
    private final Path sessionDir;
    private final VoiceTransport transport;
    private final RecordingStore store;
    private final ResamplerRegistry resamplers;
    private final RecordingProperties props;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;

    private final ConcurrentMap<String, ActiveTrack> tracks = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();

    private final Counter framesCounter;
    private final Counter droppedCounter;
    private final Counter nonStandardCounter;

    public TrackRecorder(String sessionId,
                         VoiceTransport transport,
                         RecordingStore store,
                         ResamplerRegistry resamplers,
                         RecordingProperties props,
                         Clock clock,
                         MeterRegistry meterRegistry,
                         ApplicationEventPublisher publisher) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.store = Objects.requireNonNull(store, "store");
        this.resamplers = resamplers;
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = publisher;
        this.sessionDir = Path.of(props.getDataDir()).resolve(sessionId);
        this.framesCounter = meterRegistry.counter("recorder.frames");
        this.droppedCounter = meterRegistry.counter("recorder.frames.dropped");
        this.nonStandardCounter = meterRegistry.counter("recorder.frames.nonstandard");
    }

    /**
     * Opens a track for {@code speakerId} and starts receiving its audio. No-op if the speaker
     * already has an open track.
     *
     * @throws SessionScribeException if the track file cannot be created
     */
    public void subscribe(String speakerId) {
        synchronized (lifecycleLock) {
            if (tracks.containsKey(speakerId)) {
                LOG.debug("Speaker {} already subscribed in session {}", speakerId, sessionId);
                return;
            }
            int trackNumber = store.countTracks(sessionId, speakerId) + 1;
            Path file = sessionDir.resolve(speakerId + "_" + trackNumber + ".ogg");
            OutputStream sink = null;
            OggOpusMuxer muxer;
            try {
                Files.createDirectories(sessionDir);
                sink = new BufferedOutputStream(Files.newOutputStream(file));
                muxer = new OggOpusMuxer(sink, props.getVendor());
            } catch (IOException e) {
                closeQuietly(sink, file);
                throw new SessionScribeException("Failed to open track file " + file, e);
            }

            Track track = store.insertTrack(sessionId, speakerId, trackNumber, file.toString(), clock.instant());
            ActiveTrack active = new ActiveTrack(speakerId, track.id(), file, sink, muxer);
            tracks.put(speakerId, active);
            active.audio = transport.subscribeAudio(speakerId, packet -> onFrame(speakerId, packet));
            LOG.info("Recording speaker {} to {} (track {})", speakerId, file.getFileName(), track.id());
        }
    }

    /**
     * Writes one packet to the speaker's track and forwards a copy to its resampler. Ignored when the
     * speaker has no open track.
     */
    public void onFrame(String speakerId, byte[] packet) {
        ActiveTrack track = tracks.get(speakerId);
        if (track == null) {
            return;
        }
        track.lock.lock();
        try {
            if (track.closed) {
                return;
            }
            if (!track.firstPacketSeen) {
                track.firstPacketSeen = true;
                store.markFirstPacket(track.trackId, clock.instant());
            }
            checkDuration(track, packet);
            try {
                track.muxer.writeFrame(packet);
            } catch (IOException e) {
                droppedCounter.increment();
                if (!track.writeFailed) {
                    track.writeFailed = true;
                    LOG.error("Write to {} failed; dropping frames for speaker {}", track.file, speakerId, e);
                }
                return;
            } catch (IllegalArgumentException e) {
                droppedCounter.increment();
                LOG.warn("Dropping {}-byte packet from speaker {}: {}", packet.length, speakerId, e.getMessage());
                return;
            }
            track.frameCount++;
            framesCounter.increment();
        } finally {
            track.lock.unlock();
        }

        if (resamplers != null) {
            ResamplerProcess resampler = resamplers.get(SessionSpeakerKey.of(sessionId, speakerId));
            if (resampler != null) {
                resampler.write(packet.clone());
            }
        }
    }

    /**
     * Closes the speaker's track: stops the audio feed, writes the end-of-stream page, closes the file
     * and records the end time. Idempotent.
     */
    public void close(String speakerId) {
        ActiveTrack track;
        synchronized (lifecycleLock) {
            track = tracks.remove(speakerId);
        }
        if (track == null) {
            return;
        }
        long frames;
        track.lock.lock();
        try {
            if (track.closed) {
                return;
            }
            track.closed = true;
            frames = track.frameCount;
        } finally {
            track.lock.unlock();
        }

        AudioSubscription audio = track.audio;
        if (audio != null) {
            try {
                audio.close();
            } catch (RuntimeException e) {
                LOG.warn("Failed to unsubscribe audio for speaker {}", speakerId, e);
            }
        }
        try {
            track.muxer.finish();
        } catch (IOException e) {
            LOG.warn("Failed to finalize {}: {}", track.file, e.toString());
        }
        closeQuietly(track.sink, track.file);
        store.endTrack(track.trackId, clock.instant());
        LOG.info("Closed track {} for speaker {} ({} frames)", track.trackId, speakerId, frames);
    }

    /** Closes every open track of the session. */
    public void closeAll() {
        for (String speakerId : List.copyOf(tracks.keySet())) {
            close(speakerId);
        }
    }

    /**
     * @return the open track's id and frame counter, or {@code null} if the speaker has none
     */
    public TrackPosition position(String speakerId) {
        ActiveTrack track = tracks.get(speakerId);
        if (track == null) {
            return null;
        }
        track.lock.lock();
        try {
            return track.closed ? null : new TrackPosition(track.trackId, track.frameCount);
        } finally {
            track.lock.unlock();
        }
    }

    public boolean hasTrack(String speakerId) {
        return position(speakerId) != null;
    }

    /** @return the current track id of the speaker, or {@code null} */
    public Long currentTrackId(String speakerId) {
        TrackPosition position = position(speakerId);
        return position == null ? null : position.trackId();
    }

    public List<String> openSpeakers() {
        return List.copyOf(tracks.keySet());
    }

    public String getSessionId() {
        return sessionId;
    }

    public Path getSessionDir() {
        return sessionDir;
    }

    // @GuardedBy("track.lock")
    private void checkDuration(ActiveTrack track, byte[] packet) {
        if (OpusPacketInspector.isStandardDuration(packet)) {
            return;
        }
        nonStandardCounter.increment();
        Instant now = clock.instant();
        Duration interval = props.getFrameWarningInterval();
        if (track.lastFrameWarningAt != null && now.isBefore(track.lastFrameWarningAt.plus(interval))) {
            return;
        }
        track.lastFrameWarningAt = now;
        int micros = OpusPacketInspector.packetDurationMicros(packet);
        LOG.warn("Non-standard Opus packet for speaker {} at frame {}: {} us (expected {} us); recording anyway",
                track.speakerId, track.frameCount, micros, OpusPacketInspector.STANDARD_PACKET_MICROS);
        if (publisher != null) {
            publisher.publishEvent(new NonStandardFrameEvent(sessionId, track.speakerId, track.trackId,
                    track.frameCount, micros, now));
        }
    }

    private static void closeQuietly(OutputStream sink, Path file) {
        if (sink == null) {
            return;
        }
        try {
            sink.close();
        } catch (IOException e) {
            LOG.warn("Failed to close {}: {}", file, e.toString());
        }
    }
}
