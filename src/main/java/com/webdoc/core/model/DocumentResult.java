package com.webdoc.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of document generation for one selected topic.
 * {@code outputLocation} is set iff the status is a success, {@code errorDetail} iff it is not.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentResult(
    @JsonProperty("topic_id") int topicId,
    DocumentStatus status,
    @JsonProperty("output_location") String outputLocation,
    @JsonProperty("error_detail") String errorDetail,
    int attempts
) {

    public DocumentResult {
        if (status.isSuccess() && outputLocation == null) {
            throw new IllegalArgumentException("Successful document result requires an output location");
        }
        if (!status.isSuccess() && errorDetail == null) {
            throw new IllegalArgumentException("Failed document result requires error detail");
        }
    }

    public static DocumentResult succeeded(int topicId, String outputLocation, int attempts) {
        DocumentStatus status = attempts > 1 ? DocumentStatus.RETRIED_THEN_SUCCEEDED : DocumentStatus.SUCCEEDED;
        return new DocumentResult(topicId, status, outputLocation, null, attempts);
    }

    public static DocumentResult failed(int topicId, String errorDetail, int attempts) {
        DocumentStatus status = attempts > 1 ? DocumentStatus.RETRIED_THEN_FAILED : DocumentStatus.FAILED;
        return new DocumentResult(topicId, status, null, errorDetail, attempts);
    }

    /** Result for a topic that was never attempted because the stage aborted first. */
    public static DocumentResult skipped(int topicId, String reason) {
        return new DocumentResult(topicId, DocumentStatus.FAILED, null, reason, 0);
    }

    public boolean succeeded() {
        return status.isSuccess();
    }
}
