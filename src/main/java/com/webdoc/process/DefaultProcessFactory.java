package com.webdoc.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir, Map<String, String> env) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        if (env != null && !env.isEmpty()) {
            pb.environment().putAll(env);
        }
        // Keep stderr separate from stdout: stdout is the progress channel
        pb.redirectErrorStream(false);
        return pb.start();
    }
}
