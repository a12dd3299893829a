package com.phillippitts.sessionscribe.config;

import com.phillippitts.sessionscribe.config.properties.ResamplerProperties;
import com.phillippitts.sessionscribe.config.properties.SttProperties;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

/**
 * Fails startup when the resampler's PCM rate and the rate the STT engine expects disagree.
 * Only checked with transcription enabled; an audio-only service never spawns a resampler.
 */
@Component
class SampleRateConfigurationValidator {

    private final ResamplerProperties resamplerProps;
    private final SttProperties sttProps;

    SampleRateConfigurationValidator(ResamplerProperties resamplerProps, SttProperties sttProps) {
        this.resamplerProps = resamplerProps;
        this.sttProps = sttProps;
    }

    @PostConstruct
    void validate() {
        if (!sttProps.isEnabled()) {
            return;
        }
        if (resamplerProps.getOutputSampleRate() != sttProps.getSampleRateHertz()) {
            throw new IllegalArgumentException("resampler.output-sample-rate ("
                    + resamplerProps.getOutputSampleRate() + ") must equal stt.sample-rate-hertz ("
                    + sttProps.getSampleRateHertz() + ")");
        }
    }
}
