package com.phillippitts.sessionscribe.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts external processes. Abstracted so tests can substitute scripted fake processes.
 */
@FunctionalInterface
public interface ProcessFactory {

    /**
     * @param command    executable and arguments
     * @param workingDir working directory, or {@code null} for the current one
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
