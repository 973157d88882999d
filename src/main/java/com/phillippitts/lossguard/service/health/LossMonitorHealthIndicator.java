package com.phillippitts.lossguard.service.health;

import com.phillippitts.lossguard.service.ingest.StepIngestService;
import com.phillippitts.lossguard.service.monitor.MonitorStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the monitored training run.
 *
 * <p>DOWN once a terminal condition has been raised (the run must be stopped); UP otherwise,
 * including after log-only detections, which are reported as the {@code lastAnomaly} detail.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class LossMonitorHealthIndicator implements HealthIndicator {

    private final StepIngestService ingestService;

    public LossMonitorHealthIndicator(StepIngestService ingestService) {
        this.ingestService = ingestService;
    }

    @Override
    public Health health() {
        MonitorStatus status = ingestService.status();
        Health.Builder builder = status.terminated() ? Health.down() : Health.up();

        builder.withDetail("coordinator", status.coordinator())
                .withDetail("logOnly", status.logOnly())
                .withDetail("windowSize", formatCalibrated(status.windowSize(), status.windowSizeCalibrated()))
                .withDetail("lossCap", formatCalibrated(status.lossCap(), status.lossCapCalibrated()))
                .withDetail("windowFill", status.windowFill())
                .withDetail("outlierCounter", status.outlierCounter())
                .withDetail("stepsObserved", status.stepsObserved());

        if (status.lastAnomaly() != null) {
            builder.withDetail("lastAnomaly", status.lastAnomaly().metadataKey());
        }
        if (status.terminated()) {
            builder.withDetail("status", "Run stopped: " + status.lastAnomaly().metadataKey() + " detected");
        }
        return builder.build();
    }

    private static String formatCalibrated(Object value, boolean calibrated) {
        return calibrated ? value + " (calibrated)" : String.valueOf(value);
    }
}
