package com.webdoc.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable pipeline configuration supplied with the start command.
 *
 * @param name           display name of the pipeline run
 * @param mode           run mode forwarded to both tools
 * @param idea           idea-generation arguments
 * @param doc            document-generation arguments
 * @param retryOnFailure retry a failed document once with identical arguments
 * @param failureMode    what a failed document does to the rest of the stage when retries are off
 * @param stage1Timeout  idea-stage subprocess timeout, seconds
 * @param stage2Timeout  per-document subprocess timeout, seconds
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineConfig(
    String name,
    PipelineMode mode,
    IdeaConfig idea,
    DocConfig doc,
    @JsonProperty("retry_on_failure") Boolean retryOnFailure,
    @JsonProperty("failure_mode") FailureMode failureMode,
    @JsonProperty("stage1_timeout") Long stage1Timeout,
    @JsonProperty("stage2_timeout") Long stage2Timeout
) {

    /** Format of {@code idea.start_date}, e.g. {@code 01012025}. */
    public static final DateTimeFormatter START_DATE_FORMAT = DateTimeFormatter.ofPattern("ddMMyyyy");

    /** Upper bound for {@code stage1_timeout} and {@code stage2_timeout}, seconds. */
    public static final long MAX_TIMEOUT_SECONDS = Duration.ofDays(1).toSeconds();

    /**
     * @param source         material source for the idea tool
     * @param startDate      earliest date to consider, {@code ddMMyyyy}; nullable
     * @param label          source label filter; nullable
     * @param focus          free-text focus for topic generation; nullable
     * @param combinedTopics ask the tool to merge related topics; nullable means false
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record IdeaConfig(
        IdeaSource source,
        @JsonProperty("start_date") String startDate,
        String label,
        String focus,
        @JsonProperty("combined_topics") Boolean combinedTopics
    ) {}

    /**
     * @param audience       target audience
     * @param docType        document type, e.g. "blog post"
     * @param size           length hint, e.g. "800 words"
     * @param outputLocation directory the tool writes artifacts to
     * @param styleFile      style guide file; nullable
     * @param storyFile      customer story file; nullable
     * @param mode           per-stage mode override; nullable means the pipeline mode
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DocConfig(
        String audience,
        @JsonProperty("doc_type") String docType,
        String size,
        @JsonProperty("output_location") String outputLocation,
        @JsonProperty("style_file") String styleFile,
        @JsonProperty("story_file") String storyFile,
        PipelineMode mode
    ) {}

    /** A complete, valid configuration to start from. */
    public static PipelineConfig example() {
        return new PipelineConfig(
                "My Content Pipeline",
                PipelineMode.TEST,
                new IdeaConfig(IdeaSource.GMAIL, "01012025", "AIQ",
                        "AI transformation and business strategy", false),
                new DocConfig("business executives", "blog post", "800 words", "./output",
                        null, null, null),
                true,
                FailureMode.PARTIAL,
                600L,
                300L);
    }

    /**
     * Collects every problem with this configuration. An empty list means the configuration
     * may be used to start a session.
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (isBlank(name)) {
            problems.add("name is required");
        }
        if (mode == null) {
            problems.add("mode is required (test or production)");
        }
        if (retryOnFailure == null) {
            problems.add("retry_on_failure is required");
        }
        if (failureMode == null) {
            problems.add("failure_mode is required (fail_fast or partial)");
        }
        requireTimeout(stage1Timeout, "stage1_timeout", problems);
        requireTimeout(stage2Timeout, "stage2_timeout", problems);

        if (idea == null) {
            problems.add("idea section is required");
        } else {
            if (idea.source() == null) {
                problems.add("idea.source is required");
            }
            if (!isBlank(idea.startDate())) {
                try {
                    LocalDate.parse(idea.startDate(), START_DATE_FORMAT);
                } catch (DateTimeParseException e) {
                    problems.add("idea.start_date must be in ddMMyyyy form: " + idea.startDate());
                }
            }
        }

        if (doc == null) {
            problems.add("doc section is required");
        } else {
            if (isBlank(doc.audience())) problems.add("doc.audience is required");
            if (isBlank(doc.docType())) problems.add("doc.doc_type is required");
            if (isBlank(doc.size())) problems.add("doc.size is required");
            if (isBlank(doc.outputLocation())) {
                problems.add("doc.output_location is required");
            } else {
                requireValidPath(doc.outputLocation(), "doc.output_location", problems);
            }
            requireExistingFile(doc.styleFile(), "doc.style_file", problems);
            requireExistingFile(doc.storyFile(), "doc.story_file", problems);
        }
        return problems;
    }

    public Duration stage1TimeoutDuration() {
        return Duration.ofSeconds(stage1Timeout);
    }

    public Duration stage2TimeoutDuration() {
        return Duration.ofSeconds(stage2Timeout);
    }

    public boolean retryEnabled() {
        return Boolean.TRUE.equals(retryOnFailure);
    }

    /** Mode used for the document tool: the doc override when present, else the pipeline mode. */
    public PipelineMode docMode() {
        return doc != null && doc.mode() != null ? doc.mode() : mode;
    }

    private static void requireTimeout(Long value, String field, List<String> problems) {
        if (value == null) {
            problems.add(field + " is required");
        } else if (value <= 0) {
            problems.add(field + " must be positive, got " + value);
        } else if (value > MAX_TIMEOUT_SECONDS) {
            problems.add(field + " must be at most " + MAX_TIMEOUT_SECONDS + " seconds, got " + value);
        }
    }

    private static void requireExistingFile(String path, String field, List<String> problems) {
        if (isBlank(path)) {
            return;
        }
        try {
            if (!Files.isRegularFile(Path.of(path))) {
                problems.add(field + " does not exist: " + path);
            }
        } catch (InvalidPathException e) {
            problems.add(field + " is not a valid path: " + e.getReason());
        }
    }

    private static void requireValidPath(String path, String field, List<String> problems) {
        try {
            Path.of(path);
        } catch (InvalidPathException e) {
            problems.add(field + " is not a valid path: " + e.getReason());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
