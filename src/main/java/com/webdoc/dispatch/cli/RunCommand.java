package com.webdoc.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.webdoc.core.engine.SessionController;
import com.webdoc.core.events.EventBroadcaster;
import com.webdoc.core.events.PipelineEvent;
import com.webdoc.core.events.PipelineEvents;
import com.webdoc.core.model.CommandResult;
import com.webdoc.core.model.PipelineConfig;
import com.webdoc.core.model.SessionStage;
import com.webdoc.core.model.Topic;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: webdoc run &lt;config.json&gt; [--select all|0,2,...]
 * <p>
 * Runs the whole pipeline in-process, printing the event stream. When topics are ready the
 * given selection is applied without prompting. Exits 0 only if the session completes.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a pipeline from a config file")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Pipeline configuration JSON file")
    private Path configFile;

    @Option(names = {"--select", "-s"},
            description = "Topics to generate: 'all' or comma-separated ids",
            defaultValue = "all")
    private String select;

    private final SessionController sessionController;
    private final ObjectMapper objectMapper;

    public RunCommand(SessionController sessionController, ObjectMapper objectMapper) {
        this.sessionController = sessionController;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() throws InterruptedException {
        ConsoleOutput.printBanner();

        PipelineConfig config;
        try {
            config = objectMapper.readValue(configFile.toFile(), PipelineConfig.class);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + configFile + ": " + e.getMessage());
            return 2;
        }

        EventBroadcaster.Observer observer = sessionController.subscribe();
        try {
            CommandResult started = sessionController.start(config);
            if (!started.accepted()) {
                ConsoleOutput.error(started.reason());
                return 2;
            }
            String sessionId = started.sessionId();
            ConsoleOutput.info("Session " + sessionId + " started: " + config.name());

            while (true) {
                PipelineEvent event = observer.poll(Duration.ofSeconds(1));
                if (event == null) {
                    if (observer.isClosed()) {
                        ConsoleOutput.error("Event stream closed");
                        return 1;
                    }
                    continue;
                }
                if (!sessionId.equals(event.sessionId())) {
                    continue;
                }
                ConsoleOutput.event(event);

                if (PipelineEvents.TOPICS_READY.equals(event.eventType())) {
                    List<Topic> topics = sessionController.snapshot().topics();
                    ConsoleOutput.topics(topics);
                    if (!applySelection(topics)) {
                        sessionController.cancel();
                    }
                } else if (PipelineEvents.PIPELINE_FINISHED.equals(event.eventType())) {
                    Object summary = event.payload().get("summary");
                    boolean completed = summary instanceof Map<?, ?> m
                            && SessionStage.COMPLETED.wireName().equals(m.get("stage"));
                    return completed ? 0 : 1;
                }
            }
        } finally {
            sessionController.unsubscribe(observer);
        }
    }

    private boolean applySelection(List<Topic> topics) {
        List<Integer> selection;
        try {
            selection = parseSelection(select, topics);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return false;
        }
        CommandResult result = sessionController.selectAndGenerate(selection);
        if (!result.accepted()) {
            ConsoleOutput.error("Selection rejected: " + result.reason());
            return false;
        }
        ConsoleOutput.info("Generating documents for topics " + selection);
        return true;
    }

    /**
     * Parses {@code all} or a comma-separated id list.
     *
     * @throws IllegalArgumentException if an entry is not an integer
     */
    static List<Integer> parseSelection(String spec, List<Topic> topics) {
        List<Integer> ids = new ArrayList<>();
        if (spec == null || spec.isBlank() || "all".equalsIgnoreCase(spec.strip())) {
            topics.forEach(t -> ids.add(t.id()));
            return ids;
        }
        for (String part : spec.split(",")) {
            String trimmed = part.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                ids.add(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid topic id in --select: " + trimmed);
            }
        }
        return ids;
    }
}
