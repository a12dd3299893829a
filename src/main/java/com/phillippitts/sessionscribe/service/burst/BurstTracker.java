package com.phillippitts.sessionscribe.service.burst;

import com.phillippitts.sessionscribe.domain.Burst;
import com.phillippitts.sessionscribe.persistence.RecordingStore;
import com.phillippitts.sessionscribe.service.recorder.TrackPosition;
import com.phillippitts.sessionscribe.service.recorder.TrackRecorder;
import com.phillippitts.sessionscribe.service.voice.SignalSubscription;
import com.phillippitts.sessionscribe.service.voice.SpeakingListener;
import com.phillippitts.sessionscribe.service.voice.SpeakingSignalSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns speaking edges into burst records with frame offsets into the speaker's current track.
 *
 * <p>Per speaker: {@code Idle -> Open} on speaking-start (only with an open track; a repeated start
 * is ignored), {@code Open -> Idle} on speaking-end. A burst still open after the maximum duration is
 * closed and a new one opened at the same frame offset and instant, leaving no gap.
 *
 * <p>All transitions for a session are serialised on one lock; the recorder's frame counter is read
 * through {@link TrackRecorder#position(String)} so the offset matches what has been written.
 *
 * <p>{@link #destroy()} closes every open burst and revokes only this tracker's signal subscription.
 */
public class BurstTracker implements SpeakingListener {

    private static final Logger LOG = LogManager.getLogger(BurstTracker.class);

    private final String sessionId;
    private final TrackRecorder recorder;
    private final RecordingStore store;
    private final TaskScheduler scheduler;
    private final Duration maxBurstDuration;
    private final SignalSubscription subscription;

    private final Object lock = new Object();
    // @GuardedBy("lock")
    private final Map<String, OpenBurst> openBursts = new HashMap<>();
    // @GuardedBy("lock")
    private boolean destroyed;

    public BurstTracker(String sessionId,
                        TrackRecorder recorder,
                        RecordingStore store,
                        SpeakingSignalSource signals,
                        TaskScheduler scheduler,
                        Duration maxBurstDuration) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.store = Objects.requireNonNull(store, "store");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.maxBurstDuration = Objects.requireNonNull(maxBurstDuration, "maxBurstDuration");
        this.subscription = signals.subscribe(this);
    }

    @Override
    public void onSpeakingStart(String speakerId) {
        synchronized (lock) {
            if (destroyed || openBursts.containsKey(speakerId)) {
                return;
            }
            TrackPosition position = recorder.position(speakerId);
            if (position == null) {
                LOG.debug("Speaking start for {} without an open track; no burst", speakerId);
                return;
            }
            open(speakerId, position, scheduler.getClock().instant());
        }
    }

    @Override
    public void onSpeakingEnd(String speakerId) {
        closeUserBurst(speakerId);
    }

    /**
     * Closes the speaker's open burst without reopening it. No-op if none is open.
     */
    public void closeUserBurst(String speakerId) {
        synchronized (lock) {
            OpenBurst burst = openBursts.remove(speakerId);
            if (burst != null) {
                close(burst, recorder.position(speakerId), scheduler.getClock().instant());
            }
        }
    }

    public void closeAll() {
        synchronized (lock) {
            Instant now = scheduler.getClock().instant();
            for (OpenBurst burst : List.copyOf(openBursts.values())) {
                openBursts.remove(burst.speakerId);
                close(burst, recorder.position(burst.speakerId), now);
            }
        }
    }

    /**
     * Closes all bursts and detaches from the signal source. Idempotent.
     */
    public void destroy() {
        synchronized (lock) {
            if (destroyed) {
                return;
            }
            destroyed = true;
        }
        closeAll();
        subscription.close();
        LOG.debug("Burst tracker for session {} destroyed", sessionId);
    }

    public boolean isOpen(String speakerId) {
        synchronized (lock) {
            return openBursts.containsKey(speakerId);
        }
    }

    public int openCount() {
        synchronized (lock) {
            return openBursts.size();
        }
    }

    // @GuardedBy("lock")
    private void open(String speakerId, TrackPosition position, Instant at) {
        Burst burst = store.insertBurst(position.trackId(), at, position.frameCount());
        OpenBurst open = new OpenBurst(speakerId, burst.id(), position.trackId(), position.frameCount());
        open.arm(scheduler.schedule(() -> onMaxDuration(open), at.plus(maxBurstDuration)));
        openBursts.put(speakerId, open);
        LOG.debug("Burst {} opened for {} at frame {}", burst.id(), speakerId, position.frameCount());
    }

    // @GuardedBy("lock")
    private void close(OpenBurst burst, TrackPosition position, Instant at) {
        burst.release();
        long endFrame;
        if (position != null && position.trackId() == burst.trackId) {
            endFrame = position.frameCount();
        } else {
            LOG.warn("Track {} closed before burst {} of speaker {}; recording zero-length end",
                    burst.trackId, burst.burstId, burst.speakerId);
            endFrame = burst.startFrameOffset;
        }
        store.closeBurst(burst.burstId, at, endFrame);
        LOG.debug("Burst {} closed for {} at frame {}", burst.burstId, burst.speakerId, endFrame);
    }

    private void onMaxDuration(OpenBurst burst) {
        synchronized (lock) {
            if (destroyed || openBursts.get(burst.speakerId) != burst) {
                return;
            }
            LOG.info("Burst {} for speaker {} reached {}; splitting", burst.burstId, burst.speakerId, maxBurstDuration);
            openBursts.remove(burst.speakerId);
            TrackPosition position = recorder.position(burst.speakerId);
            Instant now = scheduler.getClock().instant();
            close(burst, position, now);
            if (position != null && position.trackId() == burst.trackId) {
                open(burst.speakerId, position, now);
            }
        }
    }
}
