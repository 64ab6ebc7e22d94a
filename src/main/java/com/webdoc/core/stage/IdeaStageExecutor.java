package com.webdoc.core.stage;

import com.webdoc.config.WebDocProperties;
import com.webdoc.core.metrics.PipelineMetrics;
import com.webdoc.core.model.FailureReason;
import com.webdoc.core.model.PipelineConfig;
import com.webdoc.core.model.ProgressEvent;
import com.webdoc.core.model.Topic;
import com.webdoc.core.parser.PayloadParseException;
import com.webdoc.core.parser.ProgressParser;
import com.webdoc.core.parser.TopicPayloadParser;
import com.webdoc.process.OutcomeStatus;
import com.webdoc.process.ProcessOutcome;
import com.webdoc.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.function.IntUnaryOperator;

/**
 * Stage 1: one invocation of the idea tool, decoded into the session's topic list.
 */
@Component
public class IdeaStageExecutor extends StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(IdeaStageExecutor.class);

    private final TopicPayloadParser payloadParser;
    private final WebDocProperties.Tool tool;

    @Autowired
    public IdeaStageExecutor(ProcessRunner processRunner, ProgressParser progressParser,
                             TopicPayloadParser payloadParser, WebDocProperties properties,
                             @Autowired(required = false) PipelineMetrics metrics) {
        super(processRunner, progressParser, metrics);
        this.payloadParser = payloadParser;
        this.tool = properties.getTools().getIdea();
    }

    @Override
    protected String stageName() {
        return ProgressEvent.IDEAS;
    }

    @Override
    protected boolean isResultLine(String line) {
        return payloadParser.isPayloadLine(line);
    }

    /**
     * Runs the idea tool and decodes its topics into {@code <sessionDir>/topics}.
     */
    public IdeaStageResult run(PipelineConfig config, Path sessionDir, StageReporter reporter,
                               CancellationToken token) throws InterruptedException {
        report(reporter, 0, "Starting idea generation...");
        Path toolDir = Path.of(tool.getWorkingDir());
        Invocation invocation = invoke(tool.getCommand(), ToolCommandBuilder.ideaArgs(config), toolDir,
                config.stage1TimeoutDuration(), reporter, token, IntUnaryOperator.identity());
        ProcessOutcome outcome = invocation.outcome();
        if (metrics != null) {
            metrics.recordStageDuration(stageName(), outcome.durationMs());
        }

        if (token.isCancelled() || outcome.status() == OutcomeStatus.CANCELLED) {
            log.info("Idea generation cancelled");
            return IdeaStageResult.cancelledRun();
        }
        if (outcome.status() == OutcomeStatus.TIMED_OUT) {
            return IdeaStageResult.failed(FailureReason.TIMEOUT,
                    "Idea generation timed out after " + config.stage1Timeout() + "s");
        }
        if (!outcome.succeeded()) {
            return IdeaStageResult.failed(FailureReason.EXECUTION_ERROR,
                    "Idea generation failed: " + outcome.diagnostic());
        }

        List<Topic> topics;
        Path topicsDir = sessionDir.resolve("topics");
        try {
            List<String> payloads = invocation.resultLines();
            topics = payloads.isEmpty()
                    ? payloadParser.discoverTopicFiles(toolDir, topicsDir)
                    : payloadParser.parsePayload(payloads.get(payloads.size() - 1), topicsDir);
        } catch (PayloadParseException e) {
            return IdeaStageResult.failed(FailureReason.MALFORMED_OUTPUT, e.getMessage());
        } catch (UncheckedIOException e) {
            log.warn("Could not materialise topics: {}", e.getMessage());
            return IdeaStageResult.failed(FailureReason.EXECUTION_ERROR, e.getMessage());
        }

        if (topics.isEmpty()) {
            return IdeaStageResult.failed(FailureReason.NO_TOPICS,
                    "No topics generated. Check the source configuration.");
        }
        report(reporter, 100, "Generated " + topics.size() + " topics. Ready for review.");
        return IdeaStageResult.succeeded(topics);
    }
}
