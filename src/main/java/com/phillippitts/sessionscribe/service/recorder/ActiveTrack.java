package com.phillippitts.sessionscribe.service.recorder;

import com.phillippitts.sessionscribe.service.ogg.OggOpusMuxer;
import com.phillippitts.sessionscribe.service.voice.AudioSubscription;

import java.io.OutputStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one open track. Every field except the final ones is guarded by {@link #lock}.
 */
final class ActiveTrack {

    final String speakerId;
    final long trackId;
    final Path file;
    final OutputStream sink;
    final OggOpusMuxer muxer;
    final ReentrantLock lock = new ReentrantLock();

    volatile AudioSubscription audio;
    long frameCount;
    boolean firstPacketSeen;
    boolean closed;
    boolean writeFailed;
    Instant lastFrameWarningAt;

    ActiveTrack(String speakerId, long trackId, Path file, OutputStream sink, OggOpusMuxer muxer) {
        this.speakerId = speakerId;
        this.trackId = trackId;
        this.file = file;
        this.sink = sink;
        this.muxer = muxer;
    }
}
