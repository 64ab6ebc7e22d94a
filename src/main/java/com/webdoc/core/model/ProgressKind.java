package com.webdoc.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressKind {
    /** Line carried a percentage. */
    PROGRESS,
    /** Verbose output forwarded at the current percentage. */
    MESSAGE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
