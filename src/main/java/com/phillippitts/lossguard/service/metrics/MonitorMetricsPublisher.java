package com.phillippitts.lossguard.service.metrics;

import com.phillippitts.lossguard.domain.AnomalyKind;
import com.phillippitts.lossguard.domain.StepOutcome;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Null-safe facade over {@link LossMonitorMetrics} used by the monitor.
 *
 * <p>Lets the monitor run embedded in a training loop without a meter registry: all methods
 * are no-ops when constructed without metrics.
 *
 * @see LossMonitorMetrics
 */
public final class MonitorMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(MonitorMetricsPublisher.class);

    /**
     * Singleton no-op instance for library use and builder defaults.
     */
    public static final MonitorMetricsPublisher NOOP = new MonitorMetricsPublisher(null);

    private final LossMonitorMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable)
     */
    public MonitorMetricsPublisher(LossMonitorMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("MonitorMetricsPublisher created without metrics");
        }
    }

    public void recordStep(StepOutcome outcome, long evaluationNanos) {
        if (metrics == null || outcome == null) {
            return;
        }
        metrics.incrementSteps(outcome);
        if (outcome != StepOutcome.SKIPPED && outcome != StepOutcome.WARMING_UP) {
            metrics.recordEvaluationLatency(evaluationNanos);
        }
    }

    public void recordAnomaly(AnomalyKind kind, boolean logOnly) {
        if (metrics == null || kind == null) {
            return;
        }
        metrics.incrementAnomaly(kind, logOnly);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
