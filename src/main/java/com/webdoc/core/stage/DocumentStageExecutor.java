package com.webdoc.core.stage;

import com.webdoc.config.WebDocProperties;
import com.webdoc.core.logging.MdcContext;
import com.webdoc.core.metrics.PipelineMetrics;
import com.webdoc.core.model.DocumentResult;
import com.webdoc.core.model.FailureMode;
import com.webdoc.core.model.PipelineConfig;
import com.webdoc.core.model.ProgressEvent;
import com.webdoc.core.model.Topic;
import com.webdoc.core.parser.ProgressParser;
import com.webdoc.process.OutcomeStatus;
import com.webdoc.process.ProcessOutcome;
import com.webdoc.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stage 2: one document tool invocation per selected topic, strictly sequential in
 * selection order.
 *
 * <p>Failure policy per topic:
 * <ul>
 *   <li>retry enabled: a failed attempt is retried once with identical arguments, and the stage
 *       always continues with the next topic;</li>
 *   <li>retry disabled, {@link FailureMode#PARTIAL}: the failure is recorded and the stage
 *       continues;</li>
 *   <li>retry disabled, {@link FailureMode#FAIL_FAST}: the failure is recorded, every remaining
 *       topic gets an unattempted failed result, and the stage aborts.</li>
 * </ul>
 * A timed-out invocation is a failed attempt like any other.
 */
@Component
public class DocumentStageExecutor extends StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(DocumentStageExecutor.class);

    static final int TITLE_DISPLAY_CHARS = 40;

    private final WebDocProperties.Tool tool;

    @Autowired
    public DocumentStageExecutor(ProcessRunner processRunner, ProgressParser progressParser,
                                 WebDocProperties properties,
                                 @Autowired(required = false) PipelineMetrics metrics) {
        super(processRunner, progressParser, metrics);
        this.tool = properties.getTools().getDoc();
    }

    @Override
    protected String stageName() {
        return ProgressEvent.DOCS;
    }

    @Override
    protected boolean isResultLine(String line) {
        return ArtifactLocator.isOutputLine(line);
    }

    public DocumentStageResult run(PipelineConfig config, List<Topic> selected, StageReporter reporter,
                                   CancellationToken token) throws InterruptedException {
        int total = selected.size();
        long stageStart = System.nanoTime();
        List<DocumentResult> results = new ArrayList<>();
        try {
            for (int i = 0; i < total; i++) {
                if (token.isCancelled()) {
                    return new DocumentStageResult(DocumentStageResult.Outcome.CANCELLED, results, null);
                }
                Topic topic = selected.get(i);
                MdcContext.setTopic(topic.id());
                report(reporter, i * 100 / total,
                        "Generating document " + (i + 1) + "/" + total + ": " + shortTitle(topic.title()) + "...");

                DocumentResult result = generate(config, topic, i, total, reporter, token);
                if (result == null) {
                    return new DocumentStageResult(DocumentStageResult.Outcome.CANCELLED, results, null);
                }
                results.add(result);
                reporter.documentResult(result);

                if (!result.succeeded() && !config.retryEnabled() && config.failureMode() == FailureMode.FAIL_FAST) {
                    String detail = "Document for topic " + topic.id() + " failed: " + result.errorDetail();
                    log.warn("Fail-fast: aborting {} remaining topic(s)", total - i - 1);
                    for (Topic skipped : selected.subList(i + 1, total)) {
                        DocumentResult skippedResult = DocumentResult.skipped(skipped.id(),
                                "not attempted: stage aborted after topic " + topic.id() + " failed");
                        results.add(skippedResult);
                        reporter.documentResult(skippedResult);
                    }
                    return new DocumentStageResult(DocumentStageResult.Outcome.ABORTED, results, detail);
                }
            }
        } finally {
            MdcContext.clearTopic();
            if (metrics != null) {
                metrics.recordStageDuration(stageName(), (System.nanoTime() - stageStart) / 1_000_000);
            }
        }

        long succeeded = results.stream().filter(DocumentResult::succeeded).count();
        report(reporter, 100, "Completed! " + succeeded + "/" + total + " documents generated.");
        return new DocumentStageResult(DocumentStageResult.Outcome.FINISHED, results, null);
    }

    /**
     * Runs one topic, retrying once when enabled.
     *
     * @return the topic's result, or null if the run was cancelled
     */
    private DocumentResult generate(PipelineConfig config, Topic topic, int index, int total,
                                    StageReporter reporter, CancellationToken token) throws InterruptedException {
        int maxAttempts = config.retryEnabled() ? 2 : 1;
        String error = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                log.info("Retrying topic {} after failure: {}", topic.id(), error);
                reporter.progress(ProgressEvent.message(stageName(), "Retrying: " + shortTitle(topic.title())));
            }
            if (token.isCancelled()) {
                return null;
            }
            Attempt outcome = attempt(config, topic, index, total, reporter, token);
            if (outcome.cancelled()) {
                return null;
            }
            if (outcome.artifact() != null) {
                return DocumentResult.succeeded(topic.id(), outcome.artifact(), attempt);
            }
            error = outcome.error();
        }
        return DocumentResult.failed(topic.id(), error, maxAttempts);
    }

    private Attempt attempt(PipelineConfig config, Topic topic, int index, int total,
                            StageReporter reporter, CancellationToken token) throws InterruptedException {
        Path toolDir = Path.of(tool.getWorkingDir());
        Invocation invocation = invoke(tool.getCommand(), ToolCommandBuilder.docArgs(config, topic), toolDir,
                config.stage2TimeoutDuration(), reporter, token, p -> (index * 100 + p) / total);
        ProcessOutcome outcome = invocation.outcome();

        if (token.isCancelled() || outcome.status() == OutcomeStatus.CANCELLED) {
            return Attempt.wasCancelled();
        }
        if (outcome.status() == OutcomeStatus.TIMED_OUT) {
            return Attempt.failed("timed out after " + config.stage2Timeout() + "s");
        }
        if (!outcome.succeeded()) {
            return Attempt.failed(outcome.diagnostic());
        }

        try {
            Optional<Path> artifact = Optional.empty();
            List<String> markers = invocation.resultLines();
            if (!markers.isEmpty()) {
                artifact = ArtifactLocator.fromOutputLine(markers.get(markers.size() - 1), toolDir);
            }
            if (artifact.isEmpty()) {
                artifact = ArtifactLocator.newestSince(outputDir(config, toolDir), invocation.startedAt());
            }
            return artifact
                    .map(p -> Attempt.produced(p.toString()))
                    .orElseGet(() -> Attempt.failed("exit code 0 but no output artifact found under "
                            + config.doc().outputLocation()));
        } catch (UncheckedIOException e) {
            return Attempt.failed("could not scan output location: " + e.getMessage());
        }
    }

    private static Path outputDir(PipelineConfig config, Path toolDir) {
        Path out = Path.of(config.doc().outputLocation());
        return out.isAbsolute() ? out : toolDir.resolve(out);
    }

    static String shortTitle(String title) {
        return title.length() <= TITLE_DISPLAY_CHARS ? title : title.substring(0, TITLE_DISPLAY_CHARS);
    }

    private record Attempt(String artifact, String error, boolean cancelled) {
        static Attempt produced(String artifact) {
            return new Attempt(artifact, null, false);
        }

        static Attempt failed(String error) {
            return new Attempt(null, error, false);
        }

        static Attempt wasCancelled() {
            return new Attempt(null, null, true);
        }
    }
}
