package com.phillippitts.sessionscribe.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for the live recording path (tracks, bursts, journal).
 */
@ConfigurationProperties(prefix = "recording")
@Validated
public class RecordingProperties {

    /** Root directory; each session gets {@code {dataDir}/{sessionId}/}. */
    @NotBlank(message = "Data directory must not be blank")
    private String dataDir = "./data/sessions";

    @NotBlank(message = "Journal file must not be blank")
    private String journalFile = "./data/journal.jsonl";

    /** Bursts longer than this are closed and immediately reopened. */
    @NotNull
    private Duration maxBurstDuration = Duration.ofMinutes(10);

    /** Vendor string written into each track's OpusTags page. */
    @NotBlank
    private String vendor = "sessionscribe";

    /** Minimum interval between two non-standard frame duration warnings for the same track. */
    @NotNull
    private Duration frameWarningInterval = Duration.ofSeconds(60);

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getJournalFile() {
        return journalFile;
    }

    public void setJournalFile(String journalFile) {
        this.journalFile = journalFile;
    }

    public Duration getMaxBurstDuration() {
        return maxBurstDuration;
    }

    public void setMaxBurstDuration(Duration maxBurstDuration) {
        this.maxBurstDuration = maxBurstDuration;
    }

    public String getVendor() {
        return vendor;
    }

    public void setVendor(String vendor) {
        this.vendor = vendor;
    }

    public Duration getFrameWarningInterval() {
        return frameWarningInterval;
    }

    public void setFrameWarningInterval(Duration frameWarningInterval) {
        this.frameWarningInterval = frameWarningInterval;
    }
}
