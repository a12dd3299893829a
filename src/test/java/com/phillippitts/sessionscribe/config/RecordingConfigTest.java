package com.phillippitts.sessionscribe.config;

import com.phillippitts.sessionscribe.config.properties.SttProperties;
import com.phillippitts.sessionscribe.exception.TranscriptionException;
import com.phillippitts.sessionscribe.service.stt.EngineKey;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordingConfigTest {

    @Test
    void shouldRejectUnknownEngine() {
        assertThatThrownBy(() -> RecordingConfig.createEngine(new EngineKey("deepgram", "nova"),
                new SttProperties(), Clock.systemUTC()))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Unknown STT engine: deepgram");
    }
}
