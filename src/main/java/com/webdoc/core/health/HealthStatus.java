package com.webdoc.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * Result of checking one component WebDoc depends on: the idea tool, the doc tool or the
 * sessions directory.
 *
 * <p>Status semantics:
 * <ul>
 *   <li>{@code UP}: the component can be used as configured.</li>
 *   <li>{@code DEGRADED}: the tool's executable resolves but a script argument it is given is
 *       missing, so a launch will start and then fail. Sessions may still be started.</li>
 *   <li>{@code DOWN}: a launch cannot succeed (no command, missing working directory or
 *       executable, unwritable sessions directory). Health endpoints report 503.</li>
 * </ul>
 *
 * @param component component name, e.g. {@code idea-tool}
 * @param status    check outcome
 * @param detail    one-line human-readable explanation
 * @param metadata  resolved command, paths and similar facts; never null
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    /** The tool would launch, but a script it is pointed at is missing. */
    public static HealthStatus scriptMissing(String component, String script, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, "Script not found: " + script, metadata);
    }

    public static HealthStatus down(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DOWN, detail, metadata);
    }

    /** Worst status among {@code checks}: any DOWN wins, then any DEGRADED, else UP. */
    public static Status overall(Collection<HealthStatus> checks) {
        Status worst = Status.UP;
        for (HealthStatus check : checks) {
            if (check.status().compareTo(worst) > 0) {
                worst = check.status();
            }
        }
        return worst;
    }
}
