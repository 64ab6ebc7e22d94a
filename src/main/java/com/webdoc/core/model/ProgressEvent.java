package com.webdoc.core.model;

import java.time.Instant;

/**
 * A single progress observation for a stage.
 *
 * @param stageName stage the observation belongs to ({@code ideas} or {@code docs})
 * @param percent   completion in [0,100]; for {@link ProgressKind#MESSAGE} events this is
 *                  re-stamped with the stage's current percent before publication
 * @param message   human-readable text, never null
 * @param kind      whether the source line carried a percentage
 * @param timestamp when the line was observed
 */
public record ProgressEvent(
    String stageName,
    int percent,
    String message,
    ProgressKind kind,
    Instant timestamp
) {

    public static final String IDEAS = "ideas";
    public static final String DOCS = "docs";

    public ProgressEvent {
        percent = clamp(percent);
        message = message == null ? "" : message;
    }

    public static ProgressEvent progress(String stageName, int percent, String message) {
        return new ProgressEvent(stageName, percent, message, ProgressKind.PROGRESS, Instant.now());
    }

    public static ProgressEvent message(String stageName, String message) {
        return new ProgressEvent(stageName, 0, message, ProgressKind.MESSAGE, Instant.now());
    }

    public ProgressEvent withPercent(int newPercent) {
        return new ProgressEvent(stageName, newPercent, message, kind, timestamp);
    }

    public ProgressEvent asMessage(int currentPercent) {
        return new ProgressEvent(stageName, currentPercent, message, ProgressKind.MESSAGE, timestamp);
    }

    public static int clamp(int value) {
        return Math.max(0, Math.min(100, value));
    }
}
