package com.phillippitts.sessionscribe.service.stt;

import com.phillippitts.sessionscribe.domain.TranscriptEvent;

/**
 * Receives interim and final transcript events from a stream.
 *
 * <p>Called on the thread that wrote the audio, never while the stream holds its internal lock.
 */
@FunctionalInterface
public interface TranscriptListener {

    void onTranscript(TranscriptEvent event);
}
