package com.phillippitts.lossguard.service.telemetry.event;

import com.phillippitts.lossguard.domain.AnomalyKind;

import java.time.Instant;
import java.util.List;

/**
 * Published when the monitor detects a loss anomaly, whether or not the run is stopped.
 *
 * @param kind loss spike or persistently high loss
 * @param step index of the step that triggered the detection
 * @param message human-readable diagnostic
 * @param lossWindow losses in the window before the step, oldest first
 * @param at when the anomaly was detected
 */
public record LossAnomalyEvent(
        AnomalyKind kind,
        long step,
        String message,
        List<Double> lossWindow,
        Instant at
) {
    public LossAnomalyEvent {
        if (at == null) {
            at = Instant.now();
        }
        lossWindow = lossWindow == null ? List.of() : List.copyOf(lossWindow);
    }
}
