package com.phillippitts.sessionscribe.service.stt.vosk;

import com.phillippitts.sessionscribe.exception.TranscriptionExceptionBuilder;
import com.phillippitts.sessionscribe.service.stt.SttEngine;
import com.phillippitts.sessionscribe.service.stt.SttEngineNames;
import com.phillippitts.sessionscribe.service.stt.SttStream;
import com.phillippitts.sessionscribe.service.stt.TranscriptListener;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.vosk.Model;
import org.vosk.Recognizer;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Vosk-based streaming engine.
 *
 * <p>Holds one JNI {@link Model}; every stream gets its own {@link Recognizer}, so any number of
 * streams can run concurrently over the shared model.
 *
 * <p>Audio contract: 16-bit signed little-endian mono PCM at {@code sampleRateHertz}.
 */
public class VoskSttEngine implements SttEngine {

    private static final Logger LOG = LogManager.getLogger(VoskSttEngine.class);

    private final String modelPath;
    private final String modelName;
    private final int sampleRateHertz;
    private final int interimsPerSecond;
    private final Clock clock;

    private final Object lock = new Object();
    // @GuardedBy("lock")
    private Model model;

    /**
     * Loads the model eagerly.
     *
     * @throws com.phillippitts.sessionscribe.exception.TranscriptionException if the model cannot be loaded
     */
    public VoskSttEngine(String modelPath, int sampleRateHertz, int interimsPerSecond, Clock clock) {
        this.modelPath = Objects.requireNonNull(modelPath, "modelPath");
        this.modelName = String.valueOf(Path.of(modelPath).getFileName());
        this.sampleRateHertz = sampleRateHertz;
        this.interimsPerSecond = interimsPerSecond;
        this.clock = Objects.requireNonNull(clock, "clock");
        LOG.info("Loading Vosk model: modelPath={}, sampleRate={}", modelPath, sampleRateHertz);
        try {
            this.model = new Model(modelPath);
        } catch (Exception e) {
            throw TranscriptionExceptionBuilder.create("Failed to load Vosk model")
                    .engine(SttEngineNames.VOSK)
                    .cause(e)
                    .metadata("modelPath", modelPath)
                    .build();
        }
        LOG.info("Vosk model {} loaded", modelName);
    }

    @Override
    public SttStream createStream(String speakerId, int sequence, TranscriptListener listener) {
        Objects.requireNonNull(listener, "listener");
        Model current;
        synchronized (lock) {
            current = model;
        }
        if (current == null) {
            throw TranscriptionExceptionBuilder.create("Engine closed")
                    .engine(SttEngineNames.VOSK)
                    .speaker(speakerId)
                    .sequence(sequence)
                    .build();
        }
        try {
            Recognizer recognizer = new Recognizer(current, (float) sampleRateHertz);
            recognizer.setWords(true);
            LOG.debug("Opened recogniser for speaker {} sequence {}", speakerId, sequence);
            return new VoskSttStream(speakerId, sequence, recognizer, listener, clock,
                    sampleRateHertz, interimsPerSecond, modelName);
        } catch (Exception e) {
            throw TranscriptionExceptionBuilder.create("Failed to open recogniser")
                    .engine(SttEngineNames.VOSK)
                    .speaker(speakerId)
                    .sequence(sequence)
                    .cause(e)
                    .metadata("modelPath", modelPath)
                    .build();
        }
    }

    @Override
    public String getEngineName() {
        return SttEngineNames.VOSK;
    }

    @Override
    public String getModelName() {
        return modelName;
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (model == null) {
                return;
            }
            try {
                model.close();
            } catch (RuntimeException e) {
                LOG.warn("Error closing Vosk model", e);
            }
            model = null;
        }
        LOG.info("Vosk engine closed");
    }
}
