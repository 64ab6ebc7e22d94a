package com.webdoc.dispatch.cli;

import com.webdoc.core.events.PipelineEvent;
import com.webdoc.core.events.PipelineEvents;
import com.webdoc.core.model.Topic;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the WebDoc CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) WEBDOC v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [WEBDOC]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void topics(List<Topic> topics) {
        for (Topic topic : topics) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) [" + topic.id() + "]|@ " + topic.title()
                    + " @|faint (" + topic.wordCount() + " words)|@"));
        }
    }

    /**
     * Prints one pipeline event as a single line.
     */
    public static void event(PipelineEvent event) {
        Map<String, Object> p = event.payload();
        String line = switch (event.eventType()) {
            case PipelineEvents.STAGE_CHANGED -> "@|fg(cyan) [STAGE]|@ " + p.get("stage");
            case PipelineEvents.PROGRESS -> "@|fg(blue) [" + p.get("stage") + " " + p.get("percent") + "%]|@ "
                    + p.get("message");
            case PipelineEvents.TOPICS_READY -> "@|fg(yellow) [TOPICS]|@ " + p.get("count") + " ready";
            case PipelineEvents.DOCUMENT_RESULT -> documentLine(p);
            case PipelineEvents.ERROR -> "@|fg(red),bold [ERROR]|@ " + p.get("reason") + ": " + p.get("detail");
            case PipelineEvents.PIPELINE_FINISHED -> "@|bold [FINISHED]|@ " + p.get("summary");
            default -> "@|fg(white) [" + event.eventType() + "]|@ " + p;
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line));
    }

    private static String documentLine(Map<String, Object> p) {
        String status = String.valueOf(p.get("status"));
        boolean ok = status.endsWith("succeeded");
        String color = ok ? "fg(green)" : "fg(red)";
        String detail = ok ? String.valueOf(p.get("output_location")) : String.valueOf(p.get("error_detail"));
        return "  @|" + color + " [DOC " + p.get("topic_id") + " " + status + "]|@ " + detail;
    }
}
