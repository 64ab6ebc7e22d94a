package com.webdoc.core.stage;

import com.webdoc.core.model.DocumentResult;

import java.util.List;

/**
 * Terminal outcome of the document stage.
 *
 * @param outcome     how the stage ended
 * @param results     one result per topic reported, in selection order
 * @param abortDetail why the stage aborted; null unless {@link Outcome#ABORTED}
 */
public record DocumentStageResult(Outcome outcome, List<DocumentResult> results, String abortDetail) {

    public enum Outcome {
        /** Every selected topic has a result. */
        FINISHED,
        /** A failure under fail-fast policy stopped the remaining topics. */
        ABORTED,
        CANCELLED
    }

    public long succeededCount() {
        return results.stream().filter(DocumentResult::succeeded).count();
    }
}
