package com.phillippitts.sessionscribe.config;

import com.phillippitts.sessionscribe.config.properties.ResamplerProperties;
import com.phillippitts.sessionscribe.config.properties.SttProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SampleRateConfigurationValidatorTest {

    @Test
    void shouldAcceptMatchingRates() {
        // Arrange
        SttProperties stt = new SttProperties();
        stt.setEnabled(true);
        SampleRateConfigurationValidator validator =
                new SampleRateConfigurationValidator(new ResamplerProperties(), stt);

        // Act & Assert
        assertThatCode(validator::validate).doesNotThrowAnyException();
    }

    @Test
    void shouldRejectResamplerRateThatDiffersFromEngineRate() {
        // Arrange
        ResamplerProperties resampler = new ResamplerProperties();
        resampler.setOutputSampleRate(8_000);
        SttProperties stt = new SttProperties();
        stt.setEnabled(true);
        SampleRateConfigurationValidator validator = new SampleRateConfigurationValidator(resampler, stt);

        // Act & Assert
        assertThatThrownBy(validator::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("resampler.output-sample-rate (8000)")
                .hasMessageContaining("stt.sample-rate-hertz (16000)");
    }

    @Test
    void shouldIgnoreMismatchWhenTranscriptionDisabled() {
        // Arrange
        ResamplerProperties resampler = new ResamplerProperties();
        resampler.setOutputSampleRate(8_000);
        SampleRateConfigurationValidator validator =
                new SampleRateConfigurationValidator(resampler, new SttProperties());

        // Act & Assert
        assertThatCode(validator::validate).doesNotThrowAnyException();
    }
}
