package com.phillippitts.sessionscribe.service.voice;

import java.util.function.Consumer;

/**
 * Voice connection to a chat platform, as seen by the recorder.
 *
 * <p>Implementations adapt a platform SDK. Frames are raw Opus packets of the platform's fixed
 * profile (48 kHz stereo, 20 ms). Callbacks may arrive on any thread.
 */
public interface VoiceTransport {

    /**
     * Starts delivering the speaker's Opus packets to {@code frameConsumer}.
     *
     * @return handle that stops delivery when closed
     */
    AudioSubscription subscribeAudio(String speakerId, Consumer<byte[]> frameConsumer);

    /**
     * Speaking-start/speaking-end edges for every speaker on this connection. The source outlives
     * any individual subscriber.
     */
    SpeakingSignalSource speakingSignals();

    /**
     * Disconnects from the voice channel. Idempotent.
     */
    void disconnect();
}
