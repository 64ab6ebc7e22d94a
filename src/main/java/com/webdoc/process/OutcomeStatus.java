package com.webdoc.process;

/**
 * Terminal status of one subprocess invocation.
 */
public enum OutcomeStatus {
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    CANCELLED
}
