package com.webdoc.core.engine;

import com.webdoc.config.WebDocProperties;
import com.webdoc.core.events.EventBroadcaster;
import com.webdoc.core.logging.MdcContext;
import com.webdoc.core.metrics.PipelineMetrics;
import com.webdoc.core.model.CommandResult;
import com.webdoc.core.model.FailureReason;
import com.webdoc.core.model.PipelineConfig;
import com.webdoc.core.model.ProgressEvent;
import com.webdoc.core.model.SessionSnapshot;
import com.webdoc.core.model.Topic;
import com.webdoc.core.stage.CancellationToken;
import com.webdoc.core.stage.DocumentStageExecutor;
import com.webdoc.core.stage.DocumentStageResult;
import com.webdoc.core.stage.IdeaStageExecutor;
import com.webdoc.core.stage.IdeaStageResult;
import com.webdoc.core.state.SessionStateMachine;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Control surface of the pipeline: start, select, cancel and subscribe.
 *
 * <p>Commands validate, apply their transition through the {@link SessionStateMachine}, launch
 * the next stage asynchronously and return at once. Stage runs execute on a dedicated daemon
 * pool and report back through the state machine; the request path never waits on a stage.
 */
@Service
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionStateMachine stateMachine;
    private final IdeaStageExecutor ideaStage;
    private final DocumentStageExecutor docStage;
    private final Path sessionsDir;
    private final PipelineMetrics metrics;

    private final Object commandLock = new Object();
    private final AtomicReference<ActiveRun> activeRun = new AtomicReference<>();
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService stageRunner = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "webdoc-stage-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SessionController(SessionStateMachine stateMachine, IdeaStageExecutor ideaStage,
                             DocumentStageExecutor docStage, WebDocProperties properties,
                             @Autowired(required = false) PipelineMetrics metrics) {
        this(stateMachine, ideaStage, docStage, Path.of(properties.getSessionsDir()), metrics);
    }

    public SessionController(SessionStateMachine stateMachine, IdeaStageExecutor ideaStage,
                             DocumentStageExecutor docStage, Path sessionsDir, PipelineMetrics metrics) {
        this.stateMachine = stateMachine;
        this.ideaStage = ideaStage;
        this.docStage = docStage;
        this.sessionsDir = sessionsDir;
        this.metrics = metrics;
    }

    /**
     * Starts a new session with the given configuration. Invalid configuration is rejected
     * before anything is launched.
     */
    public CommandResult start(PipelineConfig config) {
        if (config == null) {
            return rejected("start", CommandResult.invalid(null, stateMachine.snapshot().stage(),
                    "Pipeline configuration is required"));
        }
        List<String> problems = config.validate();
        if (!problems.isEmpty()) {
            return rejected("start", CommandResult.invalid(null, stateMachine.snapshot().stage(),
                    "Invalid pipeline configuration: " + String.join("; ", problems)));
        }

        synchronized (commandLock) {
            CommandResult result = stateMachine.start(config);
            if (!result.accepted()) {
                return rejected("start", result);
            }
            String sessionId = result.sessionId();
            CancellationToken token = new CancellationToken();
            activeRun.set(new ActiveRun(sessionId, token));
            launch(sessionId, ProgressEvent.IDEAS, () -> runIdeaStage(sessionId, config, token));
            return result;
        }
    }

    /**
     * Selects topics for document generation and launches the document stage.
     */
    public CommandResult selectAndGenerate(List<Integer> selection) {
        synchronized (commandLock) {
            CommandResult result = stateMachine.selectAndGenerate(selection);
            if (!result.accepted()) {
                return rejected("select", result);
            }
            String sessionId = result.sessionId();
            SessionSnapshot snapshot = stateMachine.snapshot();
            List<Topic> selected = snapshot.selectedTopics();
            ActiveRun run = activeRun.get();
            CancellationToken token = run != null && run.sessionId().equals(sessionId)
                    ? run.token() : new CancellationToken();
            launch(sessionId, ProgressEvent.DOCS,
                    () -> runDocumentStage(sessionId, snapshot.config(), selected, token));
            return result;
        }
    }

    /**
     * Cancels the current session and terminates its active subprocess, if any.
     */
    public CommandResult cancel() {
        synchronized (commandLock) {
            CommandResult result = stateMachine.cancel();
            if (!result.accepted()) {
                return rejected("cancel", result);
            }
            ActiveRun run = activeRun.getAndSet(null);
            if (run != null && run.sessionId().equals(result.sessionId())) {
                run.token().cancel();
            }
            return result;
        }
    }

    public SessionSnapshot snapshot() {
        return stateMachine.snapshot();
    }

    public EventBroadcaster.Observer subscribe() {
        return stateMachine.subscribe();
    }

    public void unsubscribe(EventBroadcaster.Observer observer) {
        stateMachine.unsubscribe(observer);
    }

    // ── Stage runs ───────────────────────────────────────────────────

    private void runIdeaStage(String sessionId, PipelineConfig config, CancellationToken token)
            throws InterruptedException, IOException {
        Path sessionDir = sessionsDir.resolve(sessionId);
        Files.createDirectories(sessionDir.resolve("topics"));
        IdeaStageResult result = ideaStage.run(config, sessionDir, stateMachine.reporterFor(sessionId), token);
        if (result.cancelled()) {
            return;
        }
        if (result.succeeded()) {
            stateMachine.ideaStageSucceeded(sessionId, result.topics());
        } else {
            stateMachine.ideaStageFailed(sessionId, result.failureReason(), result.detail());
            clearRun(sessionId);
        }
    }

    private void runDocumentStage(String sessionId, PipelineConfig config, List<Topic> selected,
                                  CancellationToken token) throws InterruptedException {
        try {
            DocumentStageResult result = docStage.run(config, selected, stateMachine.reporterFor(sessionId), token);
            switch (result.outcome()) {
                case FINISHED -> stateMachine.docStageFinished(sessionId);
                case ABORTED -> stateMachine.docStageAborted(sessionId, result.abortDetail());
                case CANCELLED -> log.info("Document stage for {} stopped after cancellation", sessionId);
            }
        } finally {
            clearRun(sessionId);
        }
    }

    private void launch(String sessionId, String stageName, StageTask task) {
        CompletableFuture.runAsync(() -> {
            MdcContext.setStage(sessionId, stageName);
            try {
                task.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Stage {} of session {} interrupted", stageName, sessionId);
                stateMachine.stageFailed(sessionId, FailureReason.INTERNAL_ERROR, "Stage interrupted");
            } catch (Exception e) {
                log.error("Stage {} of session {} failed unexpectedly", stageName, sessionId, e);
                String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                stateMachine.stageFailed(sessionId, FailureReason.INTERNAL_ERROR, detail);
                clearRun(sessionId);
            } finally {
                MdcContext.clear();
            }
        }, stageRunner);
    }

    private void clearRun(String sessionId) {
        ActiveRun run = activeRun.get();
        if (run != null && run.sessionId().equals(sessionId)) {
            activeRun.compareAndSet(run, null);
        }
    }

    private CommandResult rejected(String command, CommandResult result) {
        log.info("Rejected {} ({}): {}", command, result.kind(), result.reason());
        if (metrics != null) {
            metrics.recordRejectedCommand(command, result.kind().name());
        }
        return result;
    }

    @PreDestroy
    void shutdown() {
        ActiveRun run = activeRun.getAndSet(null);
        if (run != null) {
            run.token().cancel();
        }
        stageRunner.shutdown();
        try {
            if (!stageRunner.awaitTermination(5, TimeUnit.SECONDS)) {
                stageRunner.shutdownNow();
            }
        } catch (InterruptedException e) {
            stageRunner.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    private interface StageTask {
        void run() throws Exception;
    }

    private record ActiveRun(String sessionId, CancellationToken token) {}
}
