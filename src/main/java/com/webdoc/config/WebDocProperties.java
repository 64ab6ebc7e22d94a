package com.webdoc.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "webdoc")
public class WebDocProperties {

    private String sessionsDir = "sessions";
    private Tools tools = new Tools();
    private ProcessLimits process = new ProcessLimits();
    private Topics topics = new Topics();
    private Events events = new Events();
    private Sse sse = new Sse();

    public String getSessionsDir() { return sessionsDir; }
    public void setSessionsDir(String sessionsDir) { this.sessionsDir = sessionsDir; }
    public Tools getTools() { return tools; }
    public void setTools(Tools tools) { this.tools = tools; }
    public ProcessLimits getProcess() { return process; }
    public void setProcess(ProcessLimits process) { this.process = process; }
    public Topics getTopics() { return topics; }
    public void setTopics(Topics topics) { this.topics = topics; }
    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }
    public Sse getSse() { return sse; }
    public void setSse(Sse sse) { this.sse = sse; }

    public static class Tools {
        private Tool idea = new Tool(List.of("python3", "cli.py"), "../DocIdeaGenerator");
        private Tool doc = new Tool(List.of("python3", "document_generator.py"), "../PersonalizedDocGenerator");

        public Tool getIdea() { return idea; }
        public void setIdea(Tool idea) { this.idea = idea; }
        public Tool getDoc() { return doc; }
        public void setDoc(Tool doc) { this.doc = doc; }
    }

    /**
     * One external generator: the command prefix (interpreter plus script, or a binary) and
     * the directory it runs in. Relative script paths resolve against the working directory.
     */
    public static class Tool {
        private List<String> command = new ArrayList<>();
        private String workingDir = ".";

        public Tool() {}

        public Tool(List<String> command, String workingDir) {
            this.command = new ArrayList<>(command);
            this.workingDir = workingDir;
        }

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public String getWorkingDir() { return workingDir; }
        public void setWorkingDir(String workingDir) { this.workingDir = workingDir; }
    }

    public static class ProcessLimits {
        private Duration gracePeriod = Duration.ofSeconds(2);
        private int stderrMaxChars = 8192;

        public Duration getGracePeriod() { return gracePeriod; }
        public void setGracePeriod(Duration gracePeriod) { this.gracePeriod = gracePeriod; }
        public int getStderrMaxChars() { return stderrMaxChars; }
        public void setStderrMaxChars(int stderrMaxChars) { this.stderrMaxChars = stderrMaxChars; }
    }

    public static class Topics {
        private int previewChars = 300;

        public int getPreviewChars() { return previewChars; }
        public void setPreviewChars(int previewChars) { this.previewChars = previewChars; }
    }

    public static class Events {
        private int observerQueueCapacity = 1024;

        public int getObserverQueueCapacity() { return observerQueueCapacity; }
        public void setObserverQueueCapacity(int observerQueueCapacity) { this.observerQueueCapacity = observerQueueCapacity; }
    }

    public static class Sse {
        private Duration timeout = Duration.ofMinutes(30);
        private Duration heartbeatInterval = Duration.ofSeconds(30);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }
    }
}
