package com.phillippitts.sessionscribe.service.stt;

/**
 * Identifiers of the supported streaming engines.
 */
public final class SttEngineNames {

    /**
     * Offline streaming recognition on a local Vosk model.
     */
    public static final String VOSK = "vosk";

    private SttEngineNames() {
        // Utility class - prevent instantiation
    }
}
