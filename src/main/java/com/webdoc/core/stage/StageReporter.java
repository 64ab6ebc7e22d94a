package com.webdoc.core.stage;

import com.webdoc.core.model.DocumentResult;
import com.webdoc.core.model.ProgressEvent;

/**
 * Upward channel from a stage executor to the session owner. Executors never see the
 * session itself; they report observations and the owner decides whether to apply them.
 */
public interface StageReporter {

    /**
     * Reports a progress observation.
     *
     * @return false if the session no longer accepts progress (cancelled, failed, replaced)
     */
    boolean progress(ProgressEvent event);

    /**
     * Reports one topic's terminal document result.
     *
     * @return false if the result was not recorded
     */
    boolean documentResult(DocumentResult result);

    /** Whether the session this reporter is bound to is still running. */
    boolean isActive();
}
