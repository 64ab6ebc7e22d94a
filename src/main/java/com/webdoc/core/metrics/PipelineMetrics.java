package com.webdoc.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline execution.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a session reaching a terminal stage.
     *
     * @param stage terminal stage wire name: completed, failed or cancelled
     */
    public void recordSessionResult(String stage) {
        Counter.builder("webdoc.sessions.total")
                .description("Pipeline sessions by terminal stage")
                .tag("status", stage)
                .register(registry)
                .increment();
    }

    public void recordStageDuration(String stageName, long ms) {
        Timer.builder("webdoc.stage.duration")
                .tag("stage", stageName)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordDocumentResult(String status) {
        Counter.builder("webdoc.documents.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records how a subprocess invocation ended.
     *
     * @param outcome SUCCEEDED, FAILED, TIMED_OUT or CANCELLED
     */
    public void recordProcessOutcome(String outcome) {
        Counter.builder("webdoc.process.outcomes")
                .tag("outcome", outcome.toLowerCase())
                .register(registry)
                .increment();
    }

    public void recordRejectedCommand(String command, String kind) {
        Counter.builder("webdoc.commands.rejected")
                .tag("command", command)
                .tag("kind", kind.toLowerCase())
                .register(registry)
                .increment();
    }
}
