package com.webdoc.core.stage;

import com.webdoc.core.model.FailureMode;
import com.webdoc.core.model.IdeaSource;
import com.webdoc.core.model.PipelineConfig;
import com.webdoc.core.model.PipelineMode;
import com.webdoc.core.model.Topic;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolCommandBuilderTest {

    private static PipelineConfig config(PipelineConfig.IdeaConfig idea, PipelineConfig.DocConfig doc) {
        return new PipelineConfig("p", PipelineMode.PRODUCTION, idea, doc, false, FailureMode.PARTIAL, 60L, 60L);
    }

    private static final PipelineConfig.DocConfig PLAIN_DOC =
            new PipelineConfig.DocConfig("CTOs", "whitepaper", "2000 words", "./output", null, null, null);

    @Test
    void ideaArgsOmitAbsentOptionals() {
        var idea = new PipelineConfig.IdeaConfig(IdeaSource.RSS, null, "", null, false);

        assertEquals(List.of("--mode", "production", "--source", "rss", "--save-local"),
                ToolCommandBuilder.ideaArgs(config(idea, PLAIN_DOC)));
    }

    @Test
    void ideaArgsIncludeEveryOption() {
        var idea = new PipelineConfig.IdeaConfig(IdeaSource.GMAIL, "15032025", "AIQ", "platform teams", true);

        assertEquals(List.of("--mode", "production", "--source", "gmail", "--save-local",
                        "--start-date", "15032025", "--label", "AIQ", "--focus", "platform teams",
                        "--combined-topics"),
                ToolCommandBuilder.ideaArgs(config(idea, PLAIN_DOC)));
    }

    @Test
    void docArgsCarryTopicAndDocumentSettings() {
        var idea = new PipelineConfig.IdeaConfig(IdeaSource.GMAIL, null, null, null, null);
        var doc = new PipelineConfig.DocConfig("CTOs", "whitepaper", "2000 words", "./output",
                "style.md", "story.md", PipelineMode.TEST);
        Topic topic = new Topic(3, "Edge Inference", "preview", 120, "/tmp/topic_3.md");

        assertEquals(List.of("--mode", "test", "--topic", "/tmp/topic_3.md", "--title", "Edge Inference",
                        "--audience", "CTOs", "--type", "whitepaper", "--size", "2000 words",
                        "--output", "./output", "--style", "style.md", "--customer-story", "story.md"),
                ToolCommandBuilder.docArgs(config(idea, doc), topic));
    }

    @Test
    void docModeFallsBackToPipelineMode() {
        var idea = new PipelineConfig.IdeaConfig(IdeaSource.GMAIL, null, null, null, null);
        Topic topic = new Topic(0, "T", "", 0, "/tmp/t.md");

        List<String> args = ToolCommandBuilder.docArgs(config(idea, PLAIN_DOC), topic);

        assertEquals("production", args.get(1));
        assertFalse(args.contains("--style"));
    }
}
