package com.phillippitts.sessionscribe.service.health;

import com.phillippitts.sessionscribe.service.monitoring.DiskSpaceMonitor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Reports free space under the recording data directory as last measured by {@link DiskSpaceMonitor}.
 *
 * <p>Low space is {@code DEGRADED} rather than {@code DOWN}: recording continues until the disk is full.
 */
@Component
@ConditionalOnProperty(prefix = "monitoring", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RecordingDiskHealthIndicator implements HealthIndicator {

    private final DiskSpaceMonitor monitor;

    public RecordingDiskHealthIndicator(DiskSpaceMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public Health health() {
        long free = monitor.getLastFreeBytes();
        Health.Builder builder;
        if (free < 0) {
            builder = Health.unknown().withDetail("status", "Not measured yet");
        } else if (monitor.isBelowThreshold()) {
            builder = Health.status("DEGRADED").withDetail("status", "Low disk space");
        } else {
            builder = Health.up();
        }
        return builder.withDetail("path", monitor.getDataDir().toString())
                .withDetail("freeBytes", free)
                .build();
    }
}
