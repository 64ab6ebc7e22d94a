package com.webdoc.core.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("validate")
    class ValidateTests {

        @Test
        @DisplayName("example configuration is valid")
        void exampleIsValid() {
            assertEquals(List.of(), PipelineConfig.example().validate());
        }

        @Test
        @DisplayName("every missing field is reported")
        void collectsAllProblems() {
            PipelineConfig empty = new PipelineConfig(null, null, null, null, null, null, null, null);

            List<String> problems = empty.validate();

            assertTrue(problems.contains("name is required"));
            assertTrue(problems.contains("mode is required (test or production)"));
            assertTrue(problems.contains("idea section is required"));
            assertTrue(problems.contains("doc section is required"));
            assertTrue(problems.contains("stage1_timeout is required"));
            assertEquals(8, problems.size());
        }

        @Test
        @DisplayName("non-positive timeouts are rejected")
        void nonPositiveTimeouts() {
            PipelineConfig example = PipelineConfig.example();
            PipelineConfig config = new PipelineConfig(example.name(), example.mode(), example.idea(), example.doc(),
                    true, FailureMode.PARTIAL, 0L, -5L);

            assertEquals(List.of("stage1_timeout must be positive, got 0", "stage2_timeout must be positive, got -5"),
                    config.validate());
        }

        @Test
        @DisplayName("timeouts above one day are rejected")
        void oversizedTimeouts() {
            PipelineConfig example = PipelineConfig.example();
            PipelineConfig config = new PipelineConfig(example.name(), example.mode(), example.idea(), example.doc(),
                    true, FailureMode.PARTIAL, 10_000_000_000_000_000L, 86_400L);

            assertEquals(List.of("stage1_timeout must be at most 86400 seconds, got 10000000000000000"),
                    config.validate());
        }

        @Test
        @DisplayName("start date must be ddMMyyyy")
        void badStartDate() {
            PipelineConfig example = PipelineConfig.example();
            PipelineConfig config = new PipelineConfig(example.name(), example.mode(),
                    new PipelineConfig.IdeaConfig(IdeaSource.GMAIL, "2025-01-01", null, null, null),
                    example.doc(), true, FailureMode.PARTIAL, 10L, 10L);

            assertEquals(1, config.validate().size());
            assertTrue(config.validate().get(0).startsWith("idea.start_date"));
        }

        @Test
        @DisplayName("style and story files must exist when given")
        void referencedFilesMustExist(@TempDir Path dir) throws Exception {
            Path style = Files.writeString(dir.resolve("style.md"), "tone: plain");
            PipelineConfig example = PipelineConfig.example();
            PipelineConfig config = new PipelineConfig(example.name(), example.mode(), example.idea(),
                    new PipelineConfig.DocConfig("devs", "guide", "short", "./out",
                            style.toString(), dir.resolve("story.md").toString(), null),
                    false, FailureMode.FAIL_FAST, 10L, 10L);

            assertEquals(List.of("doc.story_file does not exist: " + dir.resolve("story.md")), config.validate());
        }

        @Test
        @DisplayName("a file path the platform cannot represent is a validation problem")
        void unrepresentableFilePath() {
            PipelineConfig example = PipelineConfig.example();
            PipelineConfig config = new PipelineConfig(example.name(), example.mode(), example.idea(),
                    new PipelineConfig.DocConfig("devs", "guide", "short", "./out",
                            "style\0.md", null, null),
                    false, FailureMode.FAIL_FAST, 10L, 10L);

            List<String> problems = config.validate();

            assertEquals(1, problems.size());
            assertTrue(problems.get(0).startsWith("doc.style_file is not a valid path"));
        }
    }

    @Nested
    @DisplayName("JSON binding")
    class JsonTests {

        @Test
        @DisplayName("reads snake_case fields and lower-case enum values")
        void readsSnakeCase() throws Exception {
            String json = """
                    {
                      "name": "Digest",
                      "mode": "production",
                      "idea": {"source": "rss", "start_date": "01022025", "combined_topics": true},
                      "doc": {"audience": "devs", "doc_type": "blog post", "size": "500 words",
                              "output_location": "./out", "mode": "test"},
                      "retry_on_failure": false,
                      "failure_mode": "fail_fast",
                      "stage1_timeout": 120,
                      "stage2_timeout": 60
                    }
                    """;

            PipelineConfig config = mapper.readValue(json, PipelineConfig.class);

            assertEquals(PipelineMode.PRODUCTION, config.mode());
            assertEquals(IdeaSource.RSS, config.idea().source());
            assertEquals("01022025", config.idea().startDate());
            assertTrue(config.idea().combinedTopics());
            assertEquals("blog post", config.doc().docType());
            assertEquals(PipelineMode.TEST, config.docMode());
            assertEquals(FailureMode.FAIL_FAST, config.failureMode());
            assertFalse(config.retryEnabled());
            assertEquals(120L, config.stage1TimeoutDuration().toSeconds());
            assertEquals(List.of(), config.validate());
        }

        @Test
        @DisplayName("writes the example with wire names and no nulls")
        void writesExample() throws Exception {
            String json = mapper.writeValueAsString(PipelineConfig.example());

            assertTrue(json.contains("\"retry_on_failure\":true"));
            assertTrue(json.contains("\"failure_mode\":\"partial\""));
            assertTrue(json.contains("\"source\":\"gmail\""));
            assertFalse(json.contains("style_file"));
        }
    }
}
