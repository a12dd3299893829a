package com.phillippitts.sessionscribe.service.health;

import com.phillippitts.sessionscribe.service.monitoring.DiskSpaceMonitor;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RecordingDiskHealthIndicatorTest {

    @Test
    void shouldReportUnknownBeforeFirstMeasurement() {
        DiskSpaceMonitor monitor = monitor(-1, false);

        Health health = new RecordingDiskHealthIndicator(monitor).health();

        assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN);
        assertThat(health.getDetails()).containsEntry("status", "Not measured yet");
    }

    @Test
    void shouldReportUpWithEnoughSpace() {
        DiskSpaceMonitor monitor = monitor(10_000_000_000L, false);

        Health health = new RecordingDiskHealthIndicator(monitor).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("freeBytes", 10_000_000_000L);
        assertThat(health.getDetails()).containsEntry("path", Path.of("/data/sessions").toString());
    }

    @Test
    void shouldReportDegradedWhenLow() {
        DiskSpaceMonitor monitor = monitor(1024, true);

        Health health = new RecordingDiskHealthIndicator(monitor).health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("status", "Low disk space");
    }

    private static DiskSpaceMonitor monitor(long freeBytes, boolean low) {
        DiskSpaceMonitor monitor = mock(DiskSpaceMonitor.class);
        when(monitor.getLastFreeBytes()).thenReturn(freeBytes);
        when(monitor.isBelowThreshold()).thenReturn(low);
        when(monitor.getDataDir()).thenReturn(Path.of("/data/sessions"));
        return monitor;
    }
}
