package com.webdoc.core.stage;

import com.webdoc.core.metrics.PipelineMetrics;
import com.webdoc.core.model.ProgressEvent;
import com.webdoc.core.parser.ProgressParser;
import com.webdoc.process.ProcessOutcome;
import com.webdoc.process.ProcessRunner;
import com.webdoc.process.RunningProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.IntUnaryOperator;

/**
 * Base class for the two pipeline stages. Holds the shared loop that runs one tool invocation:
 * launch, stream stdout through the {@link ProgressParser}, report progress upward, and wait
 * for the outcome.
 *
 * <p>Lines a subclass recognises as result markers ({@link #isResultLine}) are collected instead
 * of being forwarded as progress. Once the run is cancelled, or the session stops accepting
 * reports, the remaining output is drained and discarded.
 */
public abstract class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    protected final ProcessRunner processRunner;
    protected final ProgressParser progressParser;
    protected final PipelineMetrics metrics;

    protected StageExecutor(ProcessRunner processRunner, ProgressParser progressParser, PipelineMetrics metrics) {
        this.processRunner = processRunner;
        this.progressParser = progressParser;
        this.metrics = metrics;
    }

    /** Stage name carried on every progress event this executor emits. */
    protected abstract String stageName();

    /** Whether a stdout line is a result marker rather than progress text. */
    protected boolean isResultLine(String line) {
        return false;
    }

    /**
     * Runs one tool invocation to its outcome.
     *
     * @param scale maps the tool's own percent into the stage's overall percent
     */
    protected Invocation invoke(List<String> command, List<String> args, Path workingDir, Duration timeout,
                                StageReporter reporter, CancellationToken token,
                                IntUnaryOperator scale) throws InterruptedException {
        Instant startedAt = Instant.now();
        List<String> resultLines = new ArrayList<>();
        RunningProcess process = processRunner.start(command, args, workingDir, null, timeout);
        token.attach(process);
        try {
            Optional<String> next;
            while ((next = process.nextLine()).isPresent()) {
                String line = next.get();
                if (isResultLine(line)) {
                    resultLines.add(line);
                    continue;
                }
                if (line.isBlank() || token.isCancelled() || !reporter.isActive()) {
                    continue;
                }
                log.debug("[{}] {}", process.name(), line);
                ProgressEvent event = progressParser.parse(stageName(), line)
                        .map(e -> e.withPercent(scale.applyAsInt(e.percent())))
                        .orElseGet(() -> ProgressEvent.message(stageName(), line.strip()));
                reporter.progress(event);
            }
            ProcessOutcome outcome = process.awaitOutcome();
            if (metrics != null) {
                metrics.recordProcessOutcome(outcome.status().name());
            }
            return new Invocation(outcome, resultLines, startedAt);
        } finally {
            token.detach(process);
        }
    }

    /** Emits a framing message at an explicit percent. */
    protected void report(StageReporter reporter, int percent, String message) {
        reporter.progress(ProgressEvent.progress(stageName(), percent, message));
    }

    /**
     * Result of one tool invocation.
     *
     * @param outcome     terminal outcome of the subprocess
     * @param resultLines stdout lines recognised as result markers, in order
     * @param startedAt   when the invocation was launched
     */
    protected record Invocation(ProcessOutcome outcome, List<String> resultLines, Instant startedAt) {}
}
