package com.phillippitts.sessionscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for the per-speaker ffmpeg resampler processes.
 */
@ConfigurationProperties(prefix = "resampler")
@Validated
public class ResamplerProperties {

    @NotBlank(message = "ffmpeg path must not be blank")
    private String ffmpegPath = "ffmpeg";

    /** PCM rate handed to STT engines. */
    @Positive
    private int outputSampleRate = 16_000;

    /** A process that receives no input for this long is killed. */
    @NotNull
    private Duration idleTimeout = Duration.ofMinutes(60);

    /** Wait between SIGTERM and SIGKILL. */
    @NotNull
    private Duration killGrace = Duration.ofSeconds(2);

    /** An exit sooner than this after spawn counts as a spawn failure. */
    @NotNull
    private Duration earlyExitWindow = Duration.ofSeconds(2);

    @NotNull
    private Duration breakerWindow = Duration.ofSeconds(60);

    @Positive(message = "Breaker threshold must be positive")
    private int breakerThreshold = 3;

    /** Packets buffered for the stdin writer before input is dropped. */
    @Positive
    private int queueCapacity = 250;

    public String getFfmpegPath() {
        return ffmpegPath;
    }

    public void setFfmpegPath(String ffmpegPath) {
        this.ffmpegPath = ffmpegPath;
    }

    public int getOutputSampleRate() {
        return outputSampleRate;
    }

    public void setOutputSampleRate(int outputSampleRate) {
        this.outputSampleRate = outputSampleRate;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public void setIdleTimeout(Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    public Duration getKillGrace() {
        return killGrace;
    }

    public void setKillGrace(Duration killGrace) {
        this.killGrace = killGrace;
    }

    public Duration getEarlyExitWindow() {
        return earlyExitWindow;
    }

    public void setEarlyExitWindow(Duration earlyExitWindow) {
        this.earlyExitWindow = earlyExitWindow;
    }

    public Duration getBreakerWindow() {
        return breakerWindow;
    }

    public void setBreakerWindow(Duration breakerWindow) {
        this.breakerWindow = breakerWindow;
    }

    public int getBreakerThreshold() {
        return breakerThreshold;
    }

    public void setBreakerThreshold(int breakerThreshold) {
        this.breakerThreshold = breakerThreshold;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }
}
