package com.webdoc.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reason code attached to a failed session so clients can tell slowness from a crash.
 */
public enum FailureReason {
    EXECUTION_ERROR,
    TIMEOUT,
    MALFORMED_OUTPUT,
    NO_TOPICS,
    DOCUMENT_FAILED,
    INTERNAL_ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
