package com.phillippitts.sessionscribe.service.hydration;

import java.nio.file.Path;
import java.util.List;

/**
 * External decode and mix operations used by the reconstructor.
 */
public interface AudioToolchain {

    /**
     * @return {@code true} if the tool can be executed
     */
    boolean isAvailable();

    /**
     * Decodes an Ogg/Opus file to raw {@link PcmFormat} PCM.
     *
     * @throws com.phillippitts.sessionscribe.exception.HydrationException on failure
     */
    void decodeToPcm(Path container, Path rawOut);

    /**
     * Mixes WAV files into one loudness-normalised WAV.
     *
     * @throws com.phillippitts.sessionscribe.exception.HydrationException on failure
     */
    void mix(List<Path> inputs, Path output);
}
