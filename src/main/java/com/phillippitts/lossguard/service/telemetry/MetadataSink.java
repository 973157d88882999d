package com.phillippitts.lossguard.service.telemetry;

import java.util.Map;

/**
 * Telemetry destination that accepts structured run metadata.
 *
 * <p>Implementations must be fast and non-blocking (fire-and-forget or in-memory append):
 * they are called inline with the host's training step and the monitor neither retries nor
 * buffers calls.
 */
public interface MetadataSink extends TelemetryDestination {

    /**
     * Records one diagnostic.
     *
     * @param key metadata key, e.g. {@code loss_spike} or {@code high_loss}
     * @param message human-readable description
     * @param context extra context; always contains {@code loss_window} (oldest first)
     */
    void record(String key, String message, Map<String, Object> context);
}
