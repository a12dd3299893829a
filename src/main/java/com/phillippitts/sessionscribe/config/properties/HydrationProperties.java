package com.phillippitts.sessionscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for the offline hydration tool.
 */
@ConfigurationProperties(prefix = "hydration")
@Validated
public class HydrationProperties {

    @NotBlank
    private String ffmpegPath = "ffmpeg";

    /** Largest single silence gap inserted before a burst unless clamping is disabled. */
    @NotNull
    private Duration maxSilence = Duration.ofSeconds(300);

    /** Run ffmpeg under {@code nice -n 19} when available. */
    private boolean lowPriority = true;

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    public void setFfmpegPath(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }

    public Duration getMaxSilence() {
        return maxSilence;
    }

    public void setMaxSilence(Duration maxSilence) {
        this.maxSilence = maxSilence;
    }

    public boolean isLowPriority() {
        return lowPriority;
    }

    public void setLowPriority(boolean lowPriority) {
        this.lowPriority = lowPriority;
    }
}
