package com.webdoc.process;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and stream-reader lifecycle.
 *
 * <p>The graceful termination window is configurable ({@code webdoc.process.grace-period});
 * the values here bound the remaining cleanup steps.
 */
public final class ProcessTimeouts {

    /**
     * How long the reader waits for trailing output after the process has exited before
     * treating the stream as closed. Covers grandchildren that inherited the pipe.
     */
    public static final Duration OUTPUT_DRAIN_TIMEOUT = Duration.ofMillis(500);

    /** Interval at which a blocked line read re-checks the process state. */
    public static final Duration LINE_POLL_INTERVAL = Duration.ofMillis(100);

    /** Time the stderr reader gets to flush after exit. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Deadline for {@link Process#destroyForcibly()} to take effect. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
