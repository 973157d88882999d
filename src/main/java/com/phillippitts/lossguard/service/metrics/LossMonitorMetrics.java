package com.phillippitts.lossguard.service.metrics;

import com.phillippitts.lossguard.domain.AnomalyKind;
import com.phillippitts.lossguard.domain.StepOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for the loss monitor.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Steps seen per outcome (skipped, warming up, normal, spike, high loss)</li>
 *   <li>Detected anomalies per kind and mode (log-only or terminal)</li>
 *   <li>Detection latency for evaluated steps</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class LossMonitorMetrics {

    private static final String METRIC_PREFIX = "lossguard.monitor";

    private final MeterRegistry registry;

    public LossMonitorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Increments the step counter for an outcome.
     *
     * @param outcome what the monitor concluded for the step
     */
    public void incrementSteps(StepOutcome outcome) {
        Counter.builder(METRIC_PREFIX + ".steps")
                .description("Number of training steps fed to the monitor")
                .tag("outcome", tagValue(outcome))
                .register(registry)
                .increment();
    }

    /**
     * Increments the anomaly counter.
     *
     * @param kind detected anomaly
     * @param logOnly whether the monitor only logged the anomaly instead of stopping the run
     */
    public void incrementAnomaly(AnomalyKind kind, boolean logOnly) {
        Counter.builder(METRIC_PREFIX + ".anomalies")
                .description("Number of detected loss anomalies")
                .tag("kind", kind.metadataKey())
                .tag("mode", logOnly ? "log_only" : "terminal")
                .register(registry)
                .increment();
    }

    /**
     * Records how long detection took for one step.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordEvaluationLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".evaluation")
                .description("Time taken to evaluate one training step")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    private static String tagValue(StepOutcome outcome) {
        return outcome.name().toLowerCase(Locale.ROOT);
    }
}
