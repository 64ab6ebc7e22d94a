package com.webdoc.core.model;

/**
 * Synchronous answer to a control command. Rejections leave the session unchanged.
 *
 * @param accepted  whether the command was applied
 * @param sessionId session the command applied to; null when rejected with no session
 * @param stage     stage after the command was applied (or current stage when rejected)
 * @param kind      rejection kind; null when accepted
 * @param reason    rejection reason; null when accepted
 */
public record CommandResult(
    boolean accepted,
    String sessionId,
    SessionStage stage,
    RejectionKind kind,
    String reason
) {

    public static CommandResult accepted(String sessionId, SessionStage stage) {
        return new CommandResult(true, sessionId, stage, null, null);
    }

    public static CommandResult conflict(String sessionId, SessionStage stage, String reason) {
        return new CommandResult(false, sessionId, stage, RejectionKind.CONFLICT, reason);
    }

    public static CommandResult invalid(String sessionId, SessionStage stage, String reason) {
        return new CommandResult(false, sessionId, stage, RejectionKind.VALIDATION, reason);
    }

    public boolean isConflict() {
        return kind == RejectionKind.CONFLICT;
    }
}
