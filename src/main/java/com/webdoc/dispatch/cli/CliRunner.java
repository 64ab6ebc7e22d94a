package com.webdoc.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the {@code webdoc} command line inside the Spring context and hands picocli's exit code
 * back to Spring Boot.
 * <p>
 * {@code webdoc serve} is not executed through picocli: the embedded web server owns the
 * process and the runner returns at once, leaving the exit code at 0.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final WebDocCommand webDocCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(WebDocCommand webDocCommand, IFactory factory) {
        this.webDocCommand = webDocCommand;
        this.factory = factory;
    }

    /**
     * Whether the arguments select the {@code serve} subcommand. Only the first non-option
     * argument names a subcommand, so {@code webdoc run serve.json} is not serve mode.
     */
    public static boolean isServeMode(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return "serve".equals(arg);
            }
        }
        return false;
    }

    @Override
    public void run(String... args) throws Exception {
        if (isServeMode(args)) {
            log.debug("Serve mode, leaving the process to the web server");
            return;
        }
        exitCode = new CommandLine(webDocCommand, factory).execute(args);
        log.debug("Command finished with exit code {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
