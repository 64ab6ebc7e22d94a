package com.webdoc.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Abstraction over {@link ProcessBuilder} to enable hermetic testing of the runner.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests may provide a stub
 * implementation that returns a fake {@link Process} with scripted stdout/stderr/exit behavior.
 */
public interface ProcessFactory {
    /**
     * Starts a new process.
     *
     * @param command    full command line, with the executable as the first element
     * @param workingDir working directory for the process (may be null)
     * @param env        extra environment variables layered over the inherited environment
     * @return started {@link Process}
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir, Map<String, String> env) throws IOException;
}
