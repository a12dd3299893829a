package com.phillippitts.sessionscribe.service.stt;

/**
 * One open recognition stream for a speaker.
 *
 * <p>Audio format: 16-bit signed little-endian mono PCM at the engine's sample rate.
 */
public interface SttStream {

    /**
     * Feeds PCM to the recogniser. Ignored once the stream is closed.
     */
    void write(byte[] pcm);

    /**
     * Closes the stream, flushing any pending final result. Idempotent.
     * Does not invoke the close callback.
     */
    void close();

    boolean isOpen();

    int getSequence();

    /**
     * Callback invoked at most once when the stream closes for a reason other than {@link #close()}
     * (backend error, duration limit).
     */
    void setOnClose(Runnable onClose);
}
