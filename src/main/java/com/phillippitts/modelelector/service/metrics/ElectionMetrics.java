package com.phillippitts.modelelector.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for backend calls and elections.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Backend call latency per backend and outcome</li>
 *   <li>Call outcome counts (success, timeout, error)</li>
 *   <li>Election decisions per selected source</li>
 *   <li>Aggregate deadline overruns</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ElectionMetrics {

    private static final String METRIC_PREFIX = "elector";

    private final MeterRegistry registry;

    public ElectionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency of one backend call.
     *
     * @param backend backend name
     * @param outcome call outcome tag (success, timeout, error)
     * @param durationMs call duration in milliseconds
     */
    public void recordCallLatency(String backend, String outcome, long durationMs) {
        Timer.builder(METRIC_PREFIX + ".call.latency")
                .description("Time taken by a backend prediction call")
                .tag("backend", backend)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Increments the outcome counter for a backend.
     *
     * @param backend backend name
     * @param outcome call outcome tag (success, timeout, error)
     */
    public void incrementCallOutcome(String backend, String outcome) {
        Counter.builder(METRIC_PREFIX + ".call.outcome")
                .description("Number of backend calls by outcome")
                .tag("backend", backend)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records an election decision.
     *
     * @param decision decision kind (selected, no_backend_available)
     * @param source backend that supplied the payload, or "none"
     */
    public void recordDecision(String decision, String source) {
        Counter.builder(METRIC_PREFIX + ".decision")
                .description("Number of elections by decision and selected backend")
                .tag("decision", decision)
                .tag("source", source)
                .register(registry)
                .increment();
    }

    /**
     * Increments the aggregate deadline overrun counter.
     */
    public void incrementDeadlineExceeded() {
        Counter.builder(METRIC_PREFIX + ".aggregate.deadline.exceeded")
                .description("Number of elections that stopped collecting at the aggregate deadline")
                .register(registry)
                .increment();
    }
}
