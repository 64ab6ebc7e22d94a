package com.webdoc.core.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.webdoc.core.model.Topic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopicPayloadParserTest {

    @TempDir
    Path tempDir;

    private TopicPayloadParser parser;
    private Path topicsDir;

    @BeforeEach
    void setUp() {
        parser = new TopicPayloadParser(new ObjectMapper(), 20);
        topicsDir = tempDir.resolve("session/topics");
    }

    @Nested
    @DisplayName("TOPICS_JSON payload")
    class PayloadTests {

        @Test
        @DisplayName("recognises the payload marker")
        void recognisesMarker() {
            assertTrue(parser.isPayloadLine("TOPICS_JSON: []"));
            assertTrue(parser.isPayloadLine("  TOPICS_JSON:[]"));
            assertFalse(parser.isPayloadLine("50% TOPICS_JSON"));
            assertFalse(parser.isPayloadLine(null));
        }

        @Test
        @DisplayName("decodes topics with positional ids and explicit word count")
        void decodesTopics() throws Exception {
            List<Topic> topics = parser.parsePayload(
                    "TOPICS_JSON: [{\"title\":\"X\",\"word_count\":50},{\"title\":\"Y\",\"preview\":\"short\"}]",
                    topicsDir);

            assertEquals(2, topics.size());
            assertEquals(0, topics.get(0).id());
            assertEquals("X", topics.get(0).title());
            assertEquals(50, topics.get(0).wordCount());
            assertEquals(1, topics.get(1).id());
            assertEquals("short", topics.get(1).previewText());
            assertEquals(1, topics.get(1).wordCount());
            assertTrue(Files.isRegularFile(Path.of(topics.get(0).filePath())));
        }

        @Test
        @DisplayName("content drives preview bound, word count and file body")
        void contentDrivesFields() throws Exception {
            String content = "# Heading\n\none two three four five six seven eight";
            List<Topic> topics = parser.parsePayload(
                    "TOPICS_JSON: [{\"title\":\"T\",\"content\":\"" + content.replace("\n", "\\n") + "\"}]",
                    topicsDir);

            Topic topic = topics.get(0);
            assertEquals(20, topic.previewText().length());
            assertEquals(10, topic.wordCount());
            assertEquals(content, Files.readString(Path.of(topic.filePath())));
        }

        @Test
        @DisplayName("invalid JSON is a parse error")
        void invalidJson() {
            assertThrows(PayloadParseException.class,
                    () -> parser.parsePayload("TOPICS_JSON: [{not json", topicsDir));
        }

        @Test
        @DisplayName("non-array payload is a parse error")
        void nonArray() {
            assertThrows(PayloadParseException.class,
                    () -> parser.parsePayload("TOPICS_JSON: {\"title\":\"X\"}", topicsDir));
        }

        @Test
        @DisplayName("topic without title is a parse error")
        void missingTitle() {
            var e = assertThrows(PayloadParseException.class,
                    () -> parser.parsePayload("TOPICS_JSON: [{\"content\":\"body\"}]", topicsDir));
            assertTrue(e.getMessage().contains("no title"));
        }

        @Test
        @DisplayName("empty array decodes to no topics")
        void emptyArray() {
            assertTrue(parser.parsePayload("TOPICS_JSON: []", topicsDir).isEmpty());
        }
    }

    @Nested
    @DisplayName("file discovery")
    class DiscoveryTests {

        @Test
        @DisplayName("moves topic files into the session in name order")
        void discoversTopicFiles() throws Exception {
            Path toolDir = Files.createDirectories(tempDir.resolve("tool"));
            Files.writeString(toolDir.resolve("topic_2.md"), "# Second Topic\nbody words here");
            Files.writeString(toolDir.resolve("topic_1.md"), "# First Topic\nbody");

            List<Topic> topics = parser.discoverTopicFiles(toolDir, topicsDir);

            assertEquals(List.of("First Topic", "Second Topic"), topics.stream().map(Topic::title).toList());
            assertEquals(0, topics.get(0).id());
            assertEquals(4, topics.get(0).wordCount());
            assertFalse(Files.exists(toolDir.resolve("topic_1.md")));
            assertTrue(Files.exists(topicsDir.resolve("topic_1.md")));
        }

        @Test
        @DisplayName("falls back to analysis files when no topic files exist")
        void fallsBackToAnalysisFiles() throws Exception {
            Path toolDir = Files.createDirectories(tempDir.resolve("tool"));
            Files.writeString(toolDir.resolve("analysis_market_trends.md"), "no heading here");

            List<Topic> topics = parser.discoverTopicFiles(toolDir, topicsDir);

            assertEquals(1, topics.size());
            assertEquals("Analysis Market Trends", topics.get(0).title());
        }

        @Test
        @DisplayName("missing tool directory yields no topics")
        void missingDirectory() {
            assertTrue(parser.discoverTopicFiles(tempDir.resolve("absent"), topicsDir).isEmpty());
        }
    }

    @Test
    @DisplayName("title is the first non-empty heading")
    void extractTitle() {
        assertEquals("Real", TopicPayloadParser.extractTitle("#\n## Real\n# Later", "stem"));
        assertEquals("My File", TopicPayloadParser.extractTitle("plain", "my_file"));
    }

    @Test
    @DisplayName("word count splits on whitespace")
    void countWords() {
        assertEquals(0, TopicPayloadParser.countWords("  "));
        assertEquals(3, TopicPayloadParser.countWords(" a\tb\n c "));
    }
}
