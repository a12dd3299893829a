package com.phillippitts.sessionscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for the VAD-gated streaming transcription pipeline.
 */
@ConfigurationProperties(prefix = "stt")
@Validated
public class SttProperties {

    private boolean enabled = false;

    @NotBlank
    private String engine = "vosk";

    /** Vosk model directory. */
    private String modelPath = "models/vosk-model-small-en-us-0.15";

    @Positive
    private int sampleRateHertz = 16_000;

    /** Cumulative speech after which a stream is rotated. */
    @NotNull
    private Duration streamRotation = Duration.ofMinutes(4);

    /** How long the retired stream stays writable after a rotation. */
    @NotNull
    private Duration streamOverlap = Duration.ofSeconds(5);

    /** Silence after which the current stream is closed. */
    @NotNull
    private Duration silenceTimeout = Duration.ofSeconds(5);

    /** Delay before reopening after a stream closed unexpectedly. */
    @NotNull
    private Duration connectionCooldown = Duration.ofSeconds(2);

    @NotNull
    private Duration rotationCheckInterval = Duration.ofSeconds(30);

    /** Events from a retired stream this close to the new stream's first result are dropped. */
    @NotNull
    private Duration dedupWindow = Duration.ofSeconds(2);

    @Positive(message = "Max concurrent streams must be positive")
    private int maxConcurrentStreams = 8;

    @Positive
    private int interimThrottlePerSecond = 2;

    @Positive
    private double costWarningPerSessionUsd = 5.0;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getEngine() {
        return engine;
    }

    public void setEngine(String engine) {
        this.engine = engine;
    }

    public String getModelPath() {
        return modelPath;
    }

    public void setModelPath(String modelPath) {
        this.modelPath = modelPath;
    }

    public int getSampleRateHertz() {
        return sampleRateHertz;
    }

    public void setSampleRateHertz(int sampleRateHertz) {
        this.sampleRateHertz = sampleRateHertz;
    }

    public Duration getStreamRotation() {
        return streamRotation;
    }

    public void setStreamRotation(Duration streamRotation) {
        this.streamRotation = streamRotation;
    }

    public Duration getStreamOverlap() {
        return streamOverlap;
    }

    public void setStreamOverlap(Duration streamOverlap) {
        this.streamOverlap = streamOverlap;
    }

    public Duration getSilenceTimeout() {
        return silenceTimeout;
    }

    public void setSilenceTimeout(Duration silenceTimeout) {
        this.silenceTimeout = silenceTimeout;
    }

    public Duration getConnectionCooldown() {
        return connectionCooldown;
    }

    public void setConnectionCooldown(Duration connectionCooldown) {
        this.connectionCooldown = connectionCooldown;
    }

    public Duration getRotationCheckInterval() {
        return rotationCheckInterval;
    }

    public void setRotationCheckInterval(Duration rotationCheckInterval) {
        this.rotationCheckInterval = rotationCheckInterval;
    }

    public Duration getDedupWindow() {
        return dedupWindow;
    }

    public void setDedupWindow(Duration dedupWindow) {
        this.dedupWindow = dedupWindow;
    }

    public int getMaxConcurrentStreams() {
        return maxConcurrentStreams;
    }

    public void setMaxConcurrentStreams(int maxConcurrentStreams) {
        this.maxConcurrentStreams = maxConcurrentStreams;
    }

    public int getInterimThrottlePerSecond() {
        return interimThrottlePerSecond;
    }

    public void setInterimThrottlePerSecond(int interimThrottlePerSecond) {
        this.interimThrottlePerSecond = interimThrottlePerSecond;
    }

    public double getCostWarningPerSessionUsd() {
        return costWarningPerSessionUsd;
    }

    public void setCostWarningPerSessionUsd(double costWarningPerSessionUsd) {
        this.costWarningPerSessionUsd = costWarningPerSessionUsd;
    }
}
