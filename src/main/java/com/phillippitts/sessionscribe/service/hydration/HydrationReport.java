package com.phillippitts.sessionscribe.service.hydration;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of a session hydration. {@code mixFile} is {@code null} unless a mix was requested.
 */
public record HydrationReport(String sessionId, Path outputDir, List<TrackHydration> tracks, Path mixFile) {
}
