package com.phillippitts.lossguard.service.monitor;

import com.phillippitts.lossguard.service.metrics.MonitorMetricsPublisher;
import com.phillippitts.lossguard.service.telemetry.TelemetryDestination;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builder for {@link LossSpikeMonitor}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * LossSpikeMonitor monitor = LossSpikeMonitorBuilder.builder()
 *     .settings(MonitorSettings.defaults().withLogOnly(false))
 *     .coordinator(globalRank == 0)
 *     .destination(new LoggingMetadataSink())
 *     .build();
 * }</pre>
 *
 * @since 1.0
 */
public final class LossSpikeMonitorBuilder {

    private MonitorSettings settings = MonitorSettings.defaults();
    private boolean coordinator = true;
    private final List<TelemetryDestination> destinations = new ArrayList<>();
    private MonitorMetricsPublisher metricsPublisher;

    private LossSpikeMonitorBuilder() {
        // Private constructor - use builder() factory method
    }

    /**
     * Creates a new builder instance.
     *
     * @return new builder for LossSpikeMonitor
     */
    public static LossSpikeMonitorBuilder builder() {
        return new LossSpikeMonitorBuilder();
    }

    /**
     * Sets the monitor configuration.
     *
     * @param settings monitor settings (defaults to {@link MonitorSettings#defaults()})
     * @return this builder
     */
    public LossSpikeMonitorBuilder settings(MonitorSettings settings) {
        this.settings = settings;
        return this;
    }

    /**
     * Sets whether this process runs detection. In a multi-process run exactly one process,
     * usually global rank 0, should be the coordinator.
     *
     * @param coordinator {@code true} to run detection (default)
     * @return this builder
     */
    public LossSpikeMonitorBuilder coordinator(boolean coordinator) {
        this.coordinator = coordinator;
        return this;
    }

    /**
     * Adds a telemetry destination.
     *
     * @param destination destination to attach
     * @return this builder
     */
    public LossSpikeMonitorBuilder destination(TelemetryDestination destination) {
        this.destinations.add(Objects.requireNonNull(destination, "destination"));
        return this;
    }

    /**
     * Adds several telemetry destinations.
     *
     * @param destinations destinations to attach
     * @return this builder
     */
    public LossSpikeMonitorBuilder destinations(List<? extends TelemetryDestination> destinations) {
        destinations.forEach(this::destination);
        return this;
    }

    /**
     * Sets the metrics publisher.
     *
     * @param metricsPublisher metrics publishing service
     * @return this builder
     */
    public LossSpikeMonitorBuilder metricsPublisher(MonitorMetricsPublisher metricsPublisher) {
        this.metricsPublisher = metricsPublisher;
        return this;
    }

    /**
     * Builds the monitor.
     *
     * @return configured LossSpikeMonitor
     * @throws NullPointerException if settings is null
     */
    public LossSpikeMonitor build() {
        Objects.requireNonNull(settings, "settings is required");
        MonitorMetricsPublisher effectiveMetricsPublisher = metricsPublisher != null
                ? metricsPublisher
                : MonitorMetricsPublisher.NOOP;
        return new LossSpikeMonitor(settings, coordinator, destinations, effectiveMetricsPublisher);
    }
}
