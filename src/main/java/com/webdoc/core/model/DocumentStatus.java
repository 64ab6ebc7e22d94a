package com.webdoc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Terminal status of one topic's document generation.
 */
public enum DocumentStatus {
    @JsonProperty("succeeded") SUCCEEDED,
    @JsonProperty("failed") FAILED,
    @JsonProperty("retried-then-succeeded") RETRIED_THEN_SUCCEEDED,
    @JsonProperty("retried-then-failed") RETRIED_THEN_FAILED;

    public boolean isSuccess() {
        return this == SUCCEEDED || this == RETRIED_THEN_SUCCEEDED;
    }

    public String wireName() {
        return name().toLowerCase().replace('_', '-');
    }
}
