package com.webdoc.core.state;

/**
 * Inputs to the session state machine.
 */
public enum SessionEvent {
    START,
    IDEAS_SUCCEEDED,
    IDEAS_FAILED,
    SELECT,
    DOC_PROGRESS,
    DOCS_FINISHED,
    DOCS_ABORTED,
    STAGE_FAILED,
    CANCEL
}
