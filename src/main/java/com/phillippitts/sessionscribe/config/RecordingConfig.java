package com.phillippitts.sessionscribe.config;

import com.phillippitts.sessionscribe.config.properties.RecordingProperties;
import com.phillippitts.sessionscribe.config.properties.ResamplerProperties;
import com.phillippitts.sessionscribe.config.properties.SttProperties;
import com.phillippitts.sessionscribe.exception.TranscriptionException;
import com.phillippitts.sessionscribe.persistence.JournalRecordingStore;
import com.phillippitts.sessionscribe.service.process.DefaultProcessFactory;
import com.phillippitts.sessionscribe.service.process.ProcessFactory;
import com.phillippitts.sessionscribe.service.resampler.ResamplerRegistry;
import com.phillippitts.sessionscribe.service.stt.EngineKey;
import com.phillippitts.sessionscribe.service.stt.EngineRegistry;
import com.phillippitts.sessionscribe.service.stt.SttEngine;
import com.phillippitts.sessionscribe.service.stt.SttEngineNames;
import com.phillippitts.sessionscribe.service.stt.vosk.VoskSttEngine;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the process-wide collaborators of the recording pipeline: the journal store, the
 * resampler registry and the shared STT engine cache.
 */
@Configuration
public class RecordingConfig {

    @Bean(destroyMethod = "close")
    public JournalRecordingStore recordingStore(RecordingProperties recordingProps) {
        return new JournalRecordingStore(Path.of(recordingProps.getJournalFile()));
    }

    @Bean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    @Bean
    public ResamplerRegistry resamplerRegistry(ProcessFactory processFactory,
                                               ResamplerProperties resamplerProps,
                                               RecordingProperties recordingProps,
                                               TaskScheduler taskScheduler,
                                               MeterRegistry meterRegistry,
                                               ApplicationEventPublisher publisher) {
        return new ResamplerRegistry(processFactory, resamplerProps, recordingProps, taskScheduler,
                meterRegistry, publisher);
    }

    /**
     * Engine cache keyed by (engine, model). Engines are created lazily by the first session
     * that needs them, so a missing model only fails sessions with transcription enabled.
     */
    @Bean(destroyMethod = "close")
    public EngineRegistry engineRegistry(SttProperties sttProps, TaskScheduler taskScheduler) {
        Clock clock = taskScheduler.getClock();
        return new EngineRegistry(key -> createEngine(key, sttProps, clock));
    }

    static SttEngine createEngine(EngineKey key, SttProperties sttProps, Clock clock) {
        if (SttEngineNames.VOSK.equalsIgnoreCase(key.engine())) {
            return new VoskSttEngine(key.model(), sttProps.getSampleRateHertz(),
                    sttProps.getInterimThrottlePerSecond(), clock);
        }
        throw new TranscriptionException("Unknown STT engine: " + key.engine(), key.engine());
    }
}
