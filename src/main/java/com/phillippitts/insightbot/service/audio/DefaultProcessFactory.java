package com.phillippitts.insightbot.service.audio;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Production {@link ProcessFactory} using {@link ProcessBuilder}. Output is merged and discarded.
 */
final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        return pb.start();
    }
}
