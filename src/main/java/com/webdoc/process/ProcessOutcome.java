package com.webdoc.process;

/**
 * The single terminal report of a subprocess invocation.
 *
 * @param status     how the invocation ended
 * @param exitCode   process exit code; -1 when the process never started
 * @param stderr     buffered error-stream text (capped)
 * @param durationMs wall-clock time from launch to outcome
 */
public record ProcessOutcome(
    OutcomeStatus status,
    int exitCode,
    String stderr,
    long durationMs
) {

    /** Max characters of stderr quoted in a diagnostic. */
    public static final int DIAGNOSTIC_MAX_CHARS = 200;

    public boolean succeeded() {
        return status == OutcomeStatus.SUCCEEDED;
    }

    /**
     * Short human-readable description of a non-successful outcome.
     */
    public String diagnostic() {
        return switch (status) {
            case SUCCEEDED -> "exit code 0";
            case TIMED_OUT -> "timed out after " + durationMs + "ms";
            case CANCELLED -> "cancelled";
            case FAILED -> {
                String snippet = stderr == null ? "" : stderr.strip();
                if (snippet.length() > DIAGNOSTIC_MAX_CHARS) {
                    snippet = snippet.substring(0, DIAGNOSTIC_MAX_CHARS);
                }
                yield snippet.isEmpty()
                        ? "exit code " + exitCode
                        : "exit code " + exitCode + ": " + snippet;
            }
        };
    }
}
