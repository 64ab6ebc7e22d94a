package com.webdoc.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webdoc.core.model.PipelineConfig;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: webdoc example-config
 * <p>
 * Prints an example pipeline configuration to stdout.
 */
@Command(name = "example-config", mixinStandardHelpOptions = true,
        description = "Print an example pipeline configuration")
@Component
public class ExampleConfigCommand implements Runnable {

    private final ObjectMapper objectMapper;

    public ExampleConfigCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void run() {
        try {
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(PipelineConfig.example()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render example configuration", e);
        }
    }
}
