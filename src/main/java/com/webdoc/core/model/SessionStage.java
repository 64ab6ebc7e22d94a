package com.webdoc.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle stage of the single pipeline session.
 */
public enum SessionStage {
    IDLE,
    RUNNING_IDEAS,
    AWAITING_SELECTION,
    RUNNING_DOCS,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isRunning() {
        return this == RUNNING_IDEAS || this == RUNNING_DOCS;
    }

    /** A new session may only be started from these stages. */
    public boolean acceptsStart() {
        return this == IDLE || isTerminal();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
