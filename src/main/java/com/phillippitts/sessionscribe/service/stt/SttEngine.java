package com.phillippitts.sessionscribe.service.stt;

/**
 * Streaming speech-to-text backend.
 *
 * <p>Engines are shared between sessions through {@link EngineRegistry}; a single engine must
 * therefore support any number of concurrently open streams.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>constructed with its model configuration and loaded eagerly</li>
 *   <li>{@link #createStream(String, int, TranscriptListener)} called per speaker and rotation</li>
 *   <li>{@link #close()} once the last registry reference is released</li>
 * </ol>
 */
public interface SttEngine extends AutoCloseable {

    /**
     * Opens a new stream.
     *
     * @param speakerId speaker the audio belongs to
     * @param sequence  stream sequence number within the speaker's gate
     * @param listener  receiver of transcript events
     * @return an open stream
     * @throws com.phillippitts.sessionscribe.exception.TranscriptionException if the backend cannot
     *         open a stream
     */
    SttStream createStream(String speakerId, int sequence, TranscriptListener listener);

    String getEngineName();

    /**
     * Model identifier reported on transcript events, may be {@code null}.
     */
    String getModelName();

    @Override
    void close();
}
