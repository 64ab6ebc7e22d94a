package com.webdoc.core.stage;

import com.webdoc.core.model.PipelineConfig;
import com.webdoc.core.model.Topic;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the argument lists for the two generator tools from a pipeline configuration.
 * The returned lists exclude the tool's command prefix.
 */
public final class ToolCommandBuilder {

    private ToolCommandBuilder() {}

    public static List<String> ideaArgs(PipelineConfig config) {
        PipelineConfig.IdeaConfig idea = config.idea();
        List<String> args = new ArrayList<>();
        args.add("--mode");
        args.add(config.mode().cliValue());
        args.add("--source");
        args.add(idea.source().cliValue());
        args.add("--save-local");
        addIfPresent(args, "--start-date", idea.startDate());
        addIfPresent(args, "--label", idea.label());
        addIfPresent(args, "--focus", idea.focus());
        if (Boolean.TRUE.equals(idea.combinedTopics())) {
            args.add("--combined-topics");
        }
        return args;
    }

    public static List<String> docArgs(PipelineConfig config, Topic topic) {
        PipelineConfig.DocConfig doc = config.doc();
        List<String> args = new ArrayList<>();
        args.add("--mode");
        args.add(config.docMode().cliValue());
        args.add("--topic");
        args.add(topic.filePath());
        args.add("--title");
        args.add(topic.title());
        args.add("--audience");
        args.add(doc.audience());
        args.add("--type");
        args.add(doc.docType());
        args.add("--size");
        args.add(doc.size());
        args.add("--output");
        args.add(doc.outputLocation());
        addIfPresent(args, "--style", doc.styleFile());
        addIfPresent(args, "--customer-story", doc.storyFile());
        return args;
    }

    private static void addIfPresent(List<String> args, String flag, String value) {
        if (value != null && !value.isBlank()) {
            args.add(flag);
            args.add(value);
        }
    }
}
