package com.webdoc.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webdoc.config.WebDocProperties;
import com.webdoc.core.model.Topic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the idea tool's final result into the session's topic list.
 *
 * <p>Two result channels are supported, tried in order:
 * <ol>
 *   <li>a stdout line {@code TOPICS_JSON: [...]} holding an array of
 *       {@code {"title", "content"?, "preview"?, "word_count"?}} objects;</li>
 *   <li>markdown files the tool saved locally: {@code topic_*.md}, or failing that
 *       {@code analysis_*.md}, in the tool's working directory.</li>
 * </ol>
 * Either way every topic ends up as a markdown file in the session's topics directory, which is
 * what the document tool is pointed at.
 */
@Component
public class TopicPayloadParser {

    private static final Logger log = LoggerFactory.getLogger(TopicPayloadParser.class);

    public static final String PAYLOAD_MARKER = "TOPICS_JSON:";
    static final String TOPIC_GLOB = "topic_*.md";
    static final String ANALYSIS_GLOB = "analysis_*.md";

    private final ObjectMapper objectMapper;
    private final int previewChars;

    @Autowired
    public TopicPayloadParser(ObjectMapper objectMapper, WebDocProperties properties) {
        this(objectMapper, properties.getTopics().getPreviewChars());
    }

    public TopicPayloadParser(ObjectMapper objectMapper, int previewChars) {
        this.objectMapper = objectMapper;
        this.previewChars = previewChars;
    }

    public boolean isPayloadLine(String line) {
        return line != null && line.stripLeading().startsWith(PAYLOAD_MARKER);
    }

    /**
     * Decodes a {@code TOPICS_JSON:} line and materialises each topic under {@code topicsDir}.
     *
     * @throws PayloadParseException if the payload is not a JSON array of titled objects
     */
    public List<Topic> parsePayload(String payloadLine, Path topicsDir) {
        String json = payloadLine.stripLeading().substring(PAYLOAD_MARKER.length()).strip();
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("Topic payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new PayloadParseException("Topic payload must be a JSON array");
        }

        List<Topic> topics = new ArrayList<>();
        for (JsonNode node : root) {
            int id = topics.size();
            String title = node.path("title").asText("").strip();
            if (title.isEmpty()) {
                throw new PayloadParseException("Topic " + id + " has no title");
            }
            String content = node.hasNonNull("content") ? node.get("content").asText() : null;
            String preview = content != null ? preview(content) : preview(node.path("preview").asText(""));
            int wordCount = node.has("word_count") ? node.get("word_count").asInt()
                    : node.has("wordCount") ? node.get("wordCount").asInt()
                    : countWords(content != null ? content : preview);
            if (wordCount < 0) {
                throw new PayloadParseException("Topic " + id + " has a negative word count");
            }

            String body = content != null ? content : "# " + title + "\n\n" + preview + "\n";
            Path file = writeTopicFile(topicsDir, "topic_" + id + ".md", body);
            topics.add(new Topic(id, title, preview, wordCount, file.toString()));
        }
        log.info("Decoded {} topics from stdout payload", topics.size());
        return topics;
    }

    /**
     * Collects topic files the tool saved in its working directory, moving them into
     * {@code topicsDir}. Files are taken in name order.
     */
    public List<Topic> discoverTopicFiles(Path toolDir, Path topicsDir) {
        List<Path> files = listSorted(toolDir, TOPIC_GLOB);
        if (files.isEmpty()) {
            files = listSorted(toolDir, ANALYSIS_GLOB);
        }

        List<Topic> topics = new ArrayList<>();
        try {
            Files.createDirectories(topicsDir);
            for (Path file : files) {
                String content = Files.readString(file, StandardCharsets.UTF_8);
                String stem = file.getFileName().toString().replaceFirst("\\.md$", "");
                Path dest = topicsDir.resolve(file.getFileName());
                Files.move(file, dest, StandardCopyOption.REPLACE_EXISTING);
                topics.add(new Topic(topics.size(), extractTitle(content, stem), preview(content),
                        countWords(content), dest.toString()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to collect topic files from " + toolDir, e);
        }
        log.info("Discovered {} topic files in {}", topics.size(), toolDir);
        return topics;
    }

    /**
     * Title is the first markdown heading; without one, the file stem title-cased.
     */
    static String extractTitle(String content, String fallbackStem) {
        for (String line : content.split("\n")) {
            if (line.startsWith("#")) {
                String heading = line.replaceFirst("^#+", "").strip();
                if (!heading.isEmpty()) {
                    return heading;
                }
            }
        }
        return titleCase(fallbackStem.replace('_', ' '));
    }

    static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.strip().split("\\s+").length;
    }

    String preview(String text) {
        return text.length() <= previewChars ? text : text.substring(0, previewChars);
    }

    private static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = true;
            }
        }
        return sb.toString();
    }

    private static List<Path> listSorted(Path dir, String glob) {
        if (dir == null || !Files.isDirectory(dir)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) {
                    files.add(p);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + glob + " in " + dir, e);
        }
        files.sort(null);
        return files;
    }

    private static Path writeTopicFile(Path topicsDir, String fileName, String body) {
        try {
            Files.createDirectories(topicsDir);
            Path file = topicsDir.resolve(fileName);
            Files.writeString(file, body, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write topic file " + fileName, e);
        }
    }
}
