package com.webdoc.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for WebDoc.
 * Routes to subcommands: serve, run, example-config, health.
 */
@Command(
        name = "webdoc",
        mixinStandardHelpOptions = true,
        version = "WebDoc 0.1.0",
        description = "Two-stage content pipeline: topic ideas, then documents",
        subcommands = {
                ServeCommand.class,
                RunCommand.class,
                ExampleConfigCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class WebDocCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
