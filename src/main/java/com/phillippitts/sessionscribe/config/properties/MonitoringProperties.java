package com.phillippitts.sessionscribe.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "monitoring")
@Validated
public class MonitoringProperties {

    private boolean enabled = true;

    /** Free space under the data directory below which a warning is logged. */
    @Positive
    private long diskWarningThresholdMb = 500;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getDiskWarningThresholdMb() {
        return diskWarningThresholdMb;
    }

    public void setDiskWarningThresholdMb(long diskWarningThresholdMb) {
        this.diskWarningThresholdMb = diskWarningThresholdMb;
    }
}
