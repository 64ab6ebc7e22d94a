package com.webdoc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where the idea-generation tool reads its raw material from.
 */
public enum IdeaSource {
    @JsonProperty("gmail") GMAIL,
    @JsonProperty("rss") RSS;

    public String cliValue() {
        return name().toLowerCase();
    }
}
