package com.webdoc.core.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthStatusTest {

    @Test
    @DisplayName("overall status is the worst component status")
    void overallIsWorst() {
        HealthStatus up = HealthStatus.up("idea-tool", "Tool available", Map.of());
        HealthStatus degraded = HealthStatus.scriptMissing("doc-tool", "cli.py", Map.of());
        HealthStatus down = HealthStatus.down("sessions-dir", "Sessions directory not writable", Map.of());

        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of(up)));
        assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.overall(List.of(up, degraded)));
        assertEquals(HealthStatus.Status.DOWN, HealthStatus.overall(List.of(down, degraded, up)));
        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of()));
    }

    @Test
    @DisplayName("a missing script degrades the tool and names the script")
    void scriptMissingIsDegraded() {
        HealthStatus status = HealthStatus.scriptMissing("doc-tool", "generate.py", Map.of("command", "python3 generate.py"));

        assertEquals(HealthStatus.Status.DEGRADED, status.status());
        assertEquals("Script not found: generate.py", status.detail());
        assertEquals("python3 generate.py", status.metadata().get("command"));
    }

    @Test
    @DisplayName("null metadata becomes an empty map")
    void nullMetadata() {
        assertEquals(Map.of(), new HealthStatus("idea-tool", HealthStatus.Status.UP, "ok", null).metadata());
    }
}
