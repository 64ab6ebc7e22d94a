package com.webdoc.core.model;

/**
 * Why a control command was refused.
 */
public enum RejectionKind {
    /** Malformed input: configuration, selection. */
    VALIDATION,
    /** Command issued while the session is in a stage that does not accept it. */
    CONFLICT
}
