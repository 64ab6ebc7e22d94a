package com.webdoc.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A candidate subject produced by the idea-generation stage.
 *
 * @param id          positional index, stable within the session
 * @param title       heading of the topic
 * @param previewText bounded excerpt of the full text
 * @param wordCount   word count of the full text
 * @param filePath    materialised markdown file handed to the document tool; nullable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Topic(
    int id,
    String title,
    @JsonProperty("preview") String previewText,
    @JsonProperty("word_count") int wordCount,
    @JsonProperty("file_path") String filePath
) {}
