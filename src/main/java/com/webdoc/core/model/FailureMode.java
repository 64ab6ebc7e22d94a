package com.webdoc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Document-stage policy applied when a topic fails and retries are disabled.
 */
public enum FailureMode {
    /** One failed topic aborts the remaining topics and fails the session. */
    @JsonProperty("fail_fast") FAIL_FAST,
    /** Failed topics are recorded and processing continues. */
    @JsonProperty("partial") PARTIAL
}
