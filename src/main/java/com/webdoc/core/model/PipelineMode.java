package com.webdoc.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Run mode forwarded to both generator tools via {@code --mode}.
 */
public enum PipelineMode {
    @JsonProperty("test") TEST,
    @JsonProperty("production") PRODUCTION;

    public String cliValue() {
        return name().toLowerCase();
    }
}
