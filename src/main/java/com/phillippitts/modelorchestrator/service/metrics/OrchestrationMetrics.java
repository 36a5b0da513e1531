package com.phillippitts.modelorchestrator.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for orchestration runs.
 *
 * <ul>
 *   <li>{@code orchestrator.model.attempts} - attempts per model and outcome</li>
 *   <li>{@code orchestrator.model.latency} - per-model latency including retries</li>
 *   <li>{@code orchestrator.model.success} / {@code .failure} - final per-model results</li>
 *   <li>{@code orchestrator.run} - run duration tagged with the overall result</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class OrchestrationMetrics {

    private static final String METRIC_PREFIX = "orchestrator";

    private final MeterRegistry registry;

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param model   model id
     * @param outcome "success" or an error class wire name
     */
    public void incrementAttempt(String model, String outcome) {
        Counter.builder(METRIC_PREFIX + ".model.attempts")
                .description("Number of invocation attempts")
                .tag("model", model)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordLatency(String model, long durationMs) {
        Timer.builder(METRIC_PREFIX + ".model.latency")
                .description("Time taken by one model including retries and backoff")
                .tag("model", model)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void incrementSuccess(String model) {
        Counter.builder(METRIC_PREFIX + ".model.success")
                .description("Number of models that produced output")
                .tag("model", model)
                .register(registry)
                .increment();
    }

    public void incrementFailure(String model, String errorClass) {
        Counter.builder(METRIC_PREFIX + ".model.failure")
                .description("Number of models that failed after retries")
                .tag("model", model)
                .tag("errorClass", errorClass)
                .register(registry)
                .increment();
    }

    public void recordRun(boolean overallSuccess, long durationMs) {
        Timer.builder(METRIC_PREFIX + ".run")
                .description("Wall-clock duration of orchestration runs")
                .tag("outcome", overallSuccess ? "success" : "failure")
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
