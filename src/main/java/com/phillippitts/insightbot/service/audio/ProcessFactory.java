package com.phillippitts.insightbot.service.audio;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so that process-based converters can be tested hermetically.
 */
interface ProcessFactory {
    /**
     * Starts a new process with the given command and working directory.
     *
     * @param command full command line, with the executable as the first element
     * @param workingDir working directory for the process (may be null)
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
