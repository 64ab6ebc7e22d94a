package com.webdoc.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.webdoc.config.WebDocProperties;
import com.webdoc.core.events.EventBroadcaster;
import com.webdoc.core.events.PipelineEvent;
import com.webdoc.core.events.PipelineEvents;
import com.webdoc.core.metrics.PipelineMetrics;
import com.webdoc.core.model.CommandResult;
import com.webdoc.core.model.DocumentStatus;
import com.webdoc.core.model.FailureMode;
import com.webdoc.core.model.FailureReason;
import com.webdoc.core.model.IdeaSource;
import com.webdoc.core.model.PipelineConfig;
import com.webdoc.core.model.PipelineMode;
import com.webdoc.core.model.RejectionKind;
import com.webdoc.core.model.SessionSnapshot;
import com.webdoc.core.model.SessionStage;
import com.webdoc.core.parser.ProgressParser;
import com.webdoc.core.parser.TopicPayloadParser;
import com.webdoc.core.stage.DocumentStageExecutor;
import com.webdoc.core.stage.IdeaStageExecutor;
import com.webdoc.core.state.SessionStateMachine;
import com.webdoc.process.FakeProcess;
import com.webdoc.process.ProcessRunner;
import com.webdoc.process.ScriptedProcessFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives whole sessions through the controller with scripted tool processes.
 */
class SessionControllerTest {

    private static final String TWO_TOPICS =
            "TOPICS_JSON: [{\"title\":\"Agents in Production\",\"content\":\"# Agents\\nbody\"},"
                    + "{\"title\":\"Vector Search\",\"content\":\"# Vectors\\nbody\"}]";
    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    private ScriptedProcessFactory factory;
    private SimpleMeterRegistry registry;
    private SessionStateMachine stateMachine;
    private SessionController controller;
    private Path outputDir;

    @BeforeEach
    void setUp() throws Exception {
        factory = new ScriptedProcessFactory();
        registry = new SimpleMeterRegistry();
        PipelineMetrics metrics = new PipelineMetrics(registry);
        outputDir = Files.createDirectories(tempDir.resolve("out"));

        WebDocProperties properties = new WebDocProperties();
        Path ideaDir = Files.createDirectories(tempDir.resolve("ideas"));
        Path docDir = Files.createDirectories(tempDir.resolve("docs"));
        properties.getTools().setIdea(new WebDocProperties.Tool(List.of("idea-tool"), ideaDir.toString()));
        properties.getTools().setDoc(new WebDocProperties.Tool(List.of("doc-tool"), docDir.toString()));

        ProcessRunner runner = new ProcessRunner(factory, Duration.ofMillis(200), 8192);
        ProgressParser progressParser = new ProgressParser();
        stateMachine = new SessionStateMachine(new EventBroadcaster(256), metrics);
        controller = new SessionController(
                stateMachine,
                new IdeaStageExecutor(runner, progressParser, new TopicPayloadParser(new ObjectMapper(), 300),
                        properties, metrics),
                new DocumentStageExecutor(runner, progressParser, properties, metrics),
                tempDir.resolve("sessions"),
                metrics);
    }

    @AfterEach
    void tearDown() {
        controller.shutdown();
    }

    private PipelineConfig config(boolean retry, FailureMode failureMode) {
        return new PipelineConfig(
                "Weekly Digest",
                PipelineMode.TEST,
                new PipelineConfig.IdeaConfig(IdeaSource.RSS, null, null, null, null),
                new PipelineConfig.DocConfig("engineers", "blog post", "500 words", outputDir.toString(),
                        null, null, null),
                retry,
                failureMode,
                30L,
                30L);
    }

    private ScriptedProcessFactory.Launch producing(String fileName) {
        return command -> {
            try {
                Path artifact = Files.writeString(outputDir.resolve(fileName), "generated");
                return FakeProcess.succeeding("50% drafting", "OUTPUT: " + artifact);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        };
    }

    private SessionSnapshot awaitStage(SessionStage expected) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        SessionSnapshot snapshot = controller.snapshot();
        while (snapshot.stage() != expected && System.nanoTime() < deadline) {
            Thread.sleep(20);
            snapshot = controller.snapshot();
        }
        assertEquals(expected, snapshot.stage(), "stage never reached; last snapshot " + snapshot);
        return snapshot;
    }

    private void awaitLaunches(int count) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (factory.launchCount() < count && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(count, factory.launchCount());
    }

    /** Drains the observer until {@code pipeline_finished} arrives. */
    private List<PipelineEvent> drainUntilFinished(EventBroadcaster.Observer observer) throws InterruptedException {
        List<PipelineEvent> events = new ArrayList<>();
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (System.nanoTime() < deadline) {
            PipelineEvent event = observer.poll(Duration.ofMillis(100));
            if (event == null) {
                continue;
            }
            events.add(event);
            if (PipelineEvents.PIPELINE_FINISHED.equals(event.eventType())) {
                return events;
            }
        }
        fail("pipeline_finished never arrived; saw " + events.stream().map(PipelineEvent::eventType).toList());
        return events;
    }

    @Nested
    @DisplayName("full sessions")
    class FullSessionTests {

        @Test
        @DisplayName("ideas, selection and documents run to completed")
        void happyPath() throws Exception {
            factory.then(FakeProcess.succeeding("20% reading feeds", TWO_TOPICS))
                    .then(producing("b.md"))
                    .then(producing("a.md"));
            EventBroadcaster.Observer observer = controller.subscribe();

            CommandResult started = controller.start(config(false, FailureMode.PARTIAL));
            assertTrue(started.accepted());
            assertEquals(SessionStage.RUNNING_IDEAS, started.stage());

            SessionSnapshot awaiting = awaitStage(SessionStage.AWAITING_SELECTION);
            assertEquals(2, awaiting.topics().size());
            assertEquals("Agents in Production", awaiting.topics().get(0).title());

            CommandResult selected = controller.selectAndGenerate(List.of(1, 0));
            assertTrue(selected.accepted());

            SessionSnapshot done = awaitStage(SessionStage.COMPLETED);
            assertEquals(List.of(1, 0), done.results().stream().map(r -> r.topicId()).toList());
            assertTrue(done.results().stream().allMatch(r -> r.status() == DocumentStatus.SUCCEEDED));
            assertNotNull(done.endedAt());

            List<PipelineEvent> events = drainUntilFinished(observer);
            List<String> types = events.stream().map(PipelineEvent::eventType).toList();
            assertEquals(PipelineEvents.SNAPSHOT, types.get(0));
            assertTrue(types.indexOf(PipelineEvents.TOPICS_READY) < types.indexOf(PipelineEvents.DOCUMENT_RESULT));
            assertEquals(2, types.stream().filter(PipelineEvents.DOCUMENT_RESULT::equals).count());

            @SuppressWarnings("unchecked")
            Map<String, Object> summary = (Map<String, Object>) events.get(events.size() - 1).payload().get("summary");
            assertEquals("completed", summary.get("stage"));
            assertEquals(2L, summary.get("succeeded"));

            // Second topic selected first: the doc tool got its file first
            String firstTopicArg = factory.commands().get(1).get(factory.commands().get(1).indexOf("--topic") + 1);
            assertEquals(done.topics().get(1).filePath(), firstTopicArg);
        }

        @Test
        @DisplayName("a finished session can be followed by a new one")
        void restartAfterCompletion() throws Exception {
            factory.then(FakeProcess.succeeding(TWO_TOPICS))
                    .then(producing("a.md"))
                    .then(FakeProcess.hanging());

            String first = controller.start(config(false, FailureMode.PARTIAL)).sessionId();
            awaitStage(SessionStage.AWAITING_SELECTION);
            controller.selectAndGenerate(List.of(0));
            awaitStage(SessionStage.COMPLETED);

            CommandResult second = controller.start(config(false, FailureMode.PARTIAL));

            assertTrue(second.accepted());
            assertNotEquals(first, second.sessionId());
            assertTrue(controller.snapshot().topics().isEmpty());
            controller.cancel();
        }

        @Test
        @DisplayName("fail-fast document failure fails the session")
        void failFast() throws Exception {
            factory.then(FakeProcess.succeeding(TWO_TOPICS))
                    .then(FakeProcess.exiting(1, "template missing"));

            controller.start(config(false, FailureMode.FAIL_FAST));
            awaitStage(SessionStage.AWAITING_SELECTION);
            controller.selectAndGenerate(List.of(0, 1));

            SessionSnapshot failed = awaitStage(SessionStage.FAILED);
            assertEquals(FailureReason.DOCUMENT_FAILED, failed.failureReason());
            assertEquals(2, failed.results().size());
            assertEquals(0, failed.results().get(1).attempts());
            assertEquals(2, factory.launchCount());
        }

        @Test
        @DisplayName("partial mode completes with a mix of results")
        void partialCompletes() throws Exception {
            factory.then(FakeProcess.succeeding(TWO_TOPICS))
                    .then(FakeProcess.exiting(1, "template missing"))
                    .then(producing("b.md"));

            controller.start(config(false, FailureMode.PARTIAL));
            awaitStage(SessionStage.AWAITING_SELECTION);
            controller.selectAndGenerate(List.of(0, 1));

            SessionSnapshot done = awaitStage(SessionStage.COMPLETED);
            assertEquals(DocumentStatus.FAILED, done.results().get(0).status());
            assertEquals(DocumentStatus.SUCCEEDED, done.results().get(1).status());
        }
    }

    @Nested
    @DisplayName("idea stage failures")
    class IdeaFailureTests {

        @Test
        @DisplayName("tool error fails the session with an execution error")
        void toolError() throws Exception {
            factory.then(FakeProcess.exiting(1, "feed unreachable"));

            controller.start(config(false, FailureMode.PARTIAL));

            SessionSnapshot failed = awaitStage(SessionStage.FAILED);
            assertEquals(FailureReason.EXECUTION_ERROR, failed.failureReason());
            assertTrue(failed.errorDetail().contains("feed unreachable"));
        }

        @Test
        @DisplayName("tool that cannot be launched fails the session")
        void launchFailure() throws Exception {
            factory.thenLaunchFailure("No such file or directory");

            controller.start(config(false, FailureMode.PARTIAL));

            SessionSnapshot failed = awaitStage(SessionStage.FAILED);
            assertEquals(FailureReason.EXECUTION_ERROR, failed.failureReason());
        }

        @Test
        @DisplayName("no topics fails the session")
        void noTopics() throws Exception {
            factory.then(FakeProcess.succeeding("Nothing new today"));

            controller.start(config(false, FailureMode.PARTIAL));

            SessionSnapshot failed = awaitStage(SessionStage.FAILED);
            assertEquals(FailureReason.NO_TOPICS, failed.failureReason());
        }
    }

    @Nested
    @DisplayName("commands")
    class CommandTests {

        @Test
        @DisplayName("invalid configuration is rejected without launching anything")
        void invalidConfig() {
            PipelineConfig bad = new PipelineConfig("", PipelineMode.TEST, null, null, true,
                    FailureMode.PARTIAL, 0L, 30L);

            CommandResult result = controller.start(bad);

            assertFalse(result.accepted());
            assertEquals(RejectionKind.VALIDATION, result.kind());
            assertTrue(result.reason().startsWith("Invalid pipeline configuration"));
            assertEquals(SessionStage.IDLE, controller.snapshot().stage());
            assertEquals(0, factory.launchCount());
            assertEquals(1.0, registry.find("webdoc.commands.rejected").tag("command", "start").counter().count());
        }

        @Test
        @DisplayName("missing configuration is rejected")
        void nullConfig() {
            CommandResult result = controller.start(null);

            assertEquals(RejectionKind.VALIDATION, result.kind());
        }

        @Test
        @DisplayName("start while running is a conflict")
        void startWhileRunning() throws Exception {
            factory.then(FakeProcess.hanging("10% starting"));
            controller.start(config(false, FailureMode.PARTIAL));
            awaitLaunches(1);

            CommandResult second = controller.start(config(false, FailureMode.PARTIAL));

            assertTrue(second.isConflict());
            assertEquals(1, factory.launchCount());
            controller.cancel();
        }

        @Test
        @DisplayName("selection before topics are ready is a conflict")
        void selectTooEarly() throws Exception {
            factory.then(FakeProcess.hanging());
            controller.start(config(false, FailureMode.PARTIAL));

            CommandResult result = controller.selectAndGenerate(List.of(0));

            assertTrue(result.isConflict());
            controller.cancel();
        }

        @Test
        @DisplayName("cancel with no session is a conflict")
        void cancelIdle() {
            assertTrue(controller.cancel().isConflict());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("cancel during ideas terminates the tool")
        void cancelDuringIdeas() throws Exception {
            FakeProcess tool = FakeProcess.hanging("10% starting");
            factory.then(tool);
            controller.start(config(false, FailureMode.PARTIAL));
            awaitLaunches(1);

            CommandResult result = controller.cancel();

            assertTrue(result.accepted());
            assertEquals(SessionStage.CANCELLED, result.stage());
            long deadline = System.nanoTime() + WAIT.toNanos();
            while (!tool.destroyRequested() && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }
            assertTrue(tool.destroyRequested());
            assertTrue(controller.cancel().isConflict());
        }

        @Test
        @DisplayName("cancel during documents stops before the next topic")
        void cancelDuringDocs() throws Exception {
            FakeProcess hangingDoc = FakeProcess.hanging("10% drafting");
            factory.then(FakeProcess.succeeding(TWO_TOPICS)).then(hangingDoc);
            EventBroadcaster.Observer observer = controller.subscribe();

            controller.start(config(false, FailureMode.PARTIAL));
            awaitStage(SessionStage.AWAITING_SELECTION);
            controller.selectAndGenerate(List.of(0, 1));
            awaitLaunches(2);

            controller.cancel();

            List<PipelineEvent> events = drainUntilFinished(observer);
            assertTrue(events.stream().noneMatch(e -> PipelineEvents.DOCUMENT_RESULT.equals(e.eventType())));
            Thread.sleep(300);
            assertEquals(2, factory.launchCount());
            assertTrue(hangingDoc.destroyRequested());
            SessionSnapshot snapshot = controller.snapshot();
            assertEquals(SessionStage.CANCELLED, snapshot.stage());
            assertTrue(snapshot.cancelRequested());
            assertTrue(snapshot.results().isEmpty());
        }

        @Test
        @DisplayName("cancel while awaiting selection launches nothing further")
        void cancelAwaitingSelection() throws Exception {
            factory.then(FakeProcess.succeeding(TWO_TOPICS));
            controller.start(config(false, FailureMode.PARTIAL));
            awaitStage(SessionStage.AWAITING_SELECTION);

            controller.cancel();

            assertEquals(SessionStage.CANCELLED, controller.snapshot().stage());
            assertTrue(controller.selectAndGenerate(List.of(0)).isConflict());
            assertEquals(1, factory.launchCount());
        }
    }
}
