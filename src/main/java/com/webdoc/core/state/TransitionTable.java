package com.webdoc.core.state;

import com.webdoc.core.model.SessionStage;

import java.util.Optional;

/**
 * Total transition function of the session lifecycle.
 *
 * <pre>
 * idle | terminal    --START-----------&gt; running_ideas
 * running_ideas      --IDEAS_SUCCEEDED-&gt; awaiting_selection
 * running_ideas      --IDEAS_FAILED----&gt; failed
 * awaiting_selection --SELECT----------&gt; running_docs
 * running_docs       --DOC_PROGRESS----&gt; running_docs
 * running_docs       --DOCS_FINISHED---&gt; completed
 * running_docs       --DOCS_ABORTED----&gt; failed
 * running_*          --STAGE_FAILED----&gt; failed
 * running_* | awaiting_selection --CANCEL--&gt; cancelled
 * </pre>
 * Every other pair is rejected. {@code idle} has no session to cancel, so CANCEL is rejected there.
 */
public final class TransitionTable {

    private TransitionTable() {}

    /**
     * @return the resulting stage, or empty if {@code event} is not allowed in {@code current}
     */
    public static Optional<SessionStage> next(SessionStage current, SessionEvent event) {
        SessionStage result = switch (event) {
            case START -> current.acceptsStart() ? SessionStage.RUNNING_IDEAS : null;
            case IDEAS_SUCCEEDED -> current == SessionStage.RUNNING_IDEAS ? SessionStage.AWAITING_SELECTION : null;
            case IDEAS_FAILED -> current == SessionStage.RUNNING_IDEAS ? SessionStage.FAILED : null;
            case SELECT -> current == SessionStage.AWAITING_SELECTION ? SessionStage.RUNNING_DOCS : null;
            case DOC_PROGRESS -> current == SessionStage.RUNNING_DOCS ? SessionStage.RUNNING_DOCS : null;
            case DOCS_FINISHED -> current == SessionStage.RUNNING_DOCS ? SessionStage.COMPLETED : null;
            case DOCS_ABORTED -> current == SessionStage.RUNNING_DOCS ? SessionStage.FAILED : null;
            case STAGE_FAILED -> current.isRunning() ? SessionStage.FAILED : null;
            case CANCEL -> current.isTerminal() || current == SessionStage.IDLE ? null : SessionStage.CANCELLED;
        };
        return Optional.ofNullable(result);
    }
}
