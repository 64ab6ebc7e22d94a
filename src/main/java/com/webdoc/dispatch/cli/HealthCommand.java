package com.webdoc.dispatch.cli;

import com.webdoc.core.health.HealthCheckService;
import com.webdoc.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: webdoc health
 * <p>
 * Checks that both generator tools can be launched and the sessions directory is writable.
 * Exits non-zero if anything is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check tool availability")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        List<HealthStatus> checks = healthCheckService.checkAll();

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.info(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (HealthStatus.overall(checks) == HealthStatus.Status.DOWN) {
            ConsoleOutput.error("Overall: one or more components down");
            return 1;
        }
        ConsoleOutput.success("Overall: ready");
        return 0;
    }
}
