package com.webdoc.process;

import com.webdoc.config.WebDocProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Launches external generator tools as subprocesses.
 *
 * <p>Each {@link #start} call produces a fresh {@link RunningProcess}; handles are never
 * reused across invocations. Timeout watching and termination run on a shared daemon
 * scheduler so the caller's thread only ever blocks on output or on the final outcome.
 */
@Component
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    private final ProcessFactory processFactory;
    private final Duration gracePeriod;
    private final int stderrMaxChars;
    private final AtomicInteger invocationCounter = new AtomicInteger();

    private final ScheduledExecutorService watchdog = Executors.newScheduledThreadPool(2, r -> {
        Thread t = new Thread(r, "process-watchdog");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public ProcessRunner(WebDocProperties properties) {
        this(new DefaultProcessFactory(),
                properties.getProcess().getGracePeriod(),
                properties.getProcess().getStderrMaxChars());
    }

    public ProcessRunner(ProcessFactory processFactory, Duration gracePeriod, int stderrMaxChars) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.gracePeriod = Objects.requireNonNull(gracePeriod, "gracePeriod");
        this.stderrMaxChars = stderrMaxChars;
    }

    /**
     * Starts a subprocess.
     *
     * @param command    command prefix: executable and any fixed leading arguments
     * @param args       invocation-specific arguments appended to the command
     * @param workingDir directory to run in (nullable: inherit)
     * @param env        extra environment variables (nullable)
     * @param timeout    wall-clock limit after which the process is terminated
     * @return handle on the running process; a launch error yields a handle whose outcome is
     *         already {@link OutcomeStatus#FAILED}
     */
    public RunningProcess start(List<String> command, List<String> args, Path workingDir,
                                Map<String, String> env, Duration timeout) {
        Objects.requireNonNull(command, "command");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        List<String> fullCommand = new ArrayList<>(command);
        if (args != null) {
            fullCommand.addAll(args);
        }
        String name = "proc-" + invocationCounter.incrementAndGet();

        log.info("Launching {}: {} (cwd={}, timeout={}s)", name, fullCommand,
                workingDir, timeout != null ? timeout.toSeconds() : "none");
        try {
            Process process = processFactory.start(fullCommand, workingDir, env);
            RunningProcess running = new RunningProcess(name, process, watchdog, gracePeriod, stderrMaxChars);
            try {
                running.begin(timeout);
            } catch (RuntimeException e) {
                // The child is already running; never leave it without a watchdog
                log.warn("Failed to supervise {}, destroying it: {}", name, e.toString());
                process.destroyForcibly();
                return RunningProcess.launchFailure(name, "Failed to supervise " + fullCommand.get(0) + ": " + e);
            }
            return running;
        } catch (IOException e) {
            log.warn("Failed to launch {}: {}", fullCommand.get(0), e.getMessage());
            return RunningProcess.launchFailure(name, "Failed to launch " + fullCommand.get(0) + ": " + e.getMessage());
        }
    }

    @PreDestroy
    void shutdown() {
        watchdog.shutdown();
        try {
            if (!watchdog.awaitTermination(5, TimeUnit.SECONDS)) {
                watchdog.shutdownNow();
            }
        } catch (InterruptedException e) {
            watchdog.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
