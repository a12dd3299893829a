package com.phillippitts.sessionscribe.service.monitoring;

import com.phillippitts.sessionscribe.config.properties.MonitoringProperties;
import com.phillippitts.sessionscribe.config.properties.RecordingProperties;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Periodically checks free space under the recording data directory and warns when it falls below
 * {@code monitoring.disk-warning-threshold-mb}.
 *
 * <p>Recording keeps going when disk is low; the warning is the only signal.
 */
@Component
@ConditionalOnProperty(prefix = "monitoring", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DiskSpaceMonitor {

    private static final Logger LOG = LogManager.getLogger(DiskSpaceMonitor.class);

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final Path dataDir;
    private final long thresholdBytes;
    private volatile long lastFreeBytes = -1;

    public DiskSpaceMonitor(RecordingProperties recordingProps,
                            MonitoringProperties monitoringProps,
                            MeterRegistry meterRegistry) {
        this.dataDir = Path.of(recordingProps.getDataDir()).toAbsolutePath();
        this.thresholdBytes = monitoringProps.getDiskWarningThresholdMb() * BYTES_PER_MB;
        Gauge.builder("recording.disk.free.bytes", this, DiskSpaceMonitor::getLastFreeBytes)
                .description("Usable space under the recording data directory")
                .register(meterRegistry);
    }

    @Scheduled(initialDelay = 0, fixedDelayString = "${monitoring.disk-check-interval-ms:60000}")
    public void check() {
        if (!Files.isDirectory(dataDir)) {
            return;
        }
        try {
            FileStore store = Files.getFileStore(dataDir);
            long free = store.getUsableSpace();
            lastFreeBytes = free;
            if (free < thresholdBytes) {
                LOG.warn("Disk space low: {}MB free under {} (threshold: {}MB)",
                        free / BYTES_PER_MB, dataDir, thresholdBytes / BYTES_PER_MB);
            }
        } catch (IOException e) {
            LOG.debug("Cannot read free space for {}: {}", dataDir, e.toString());
        }
    }

    /**
     * @return usable bytes at the last check, or -1 if never measured
     */
    public long getLastFreeBytes() {
        return lastFreeBytes;
    }

    public boolean isBelowThreshold() {
        long free = lastFreeBytes;
        return free >= 0 && free < thresholdBytes;
    }

    public Path getDataDir() {
        return dataDir;
    }
}
