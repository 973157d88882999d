package com.phillippitts.lossguard.service.telemetry;

/**
 * Any telemetry backend attached to the monitor.
 *
 * <p>Only destinations that also implement {@link MetadataSink} receive anomaly diagnostics;
 * the monitor skips the others without error.
 */
public interface TelemetryDestination {

    /**
     * Human-readable name, used in logs.
     */
    default String destinationName() {
        return getClass().getSimpleName();
    }
}
