package com.phillippitts.lossguard.service.telemetry;

import com.phillippitts.lossguard.domain.AnomalyKind;
import com.phillippitts.lossguard.service.monitor.LossSpikeMonitor;
import com.phillippitts.lossguard.service.telemetry.event.LossAnomalyEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Republishes anomaly diagnostics as {@link LossAnomalyEvent} application events.
 */
public class EventPublishingMetadataSink implements MetadataSink {

    private final ApplicationEventPublisher publisher;

    public EventPublishingMetadataSink(ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public void record(String key, String message, Map<String, Object> context) {
        publisher.publishEvent(new LossAnomalyEvent(
                kindOf(key),
                stepOf(context),
                message,
                lossWindowOf(context),
                Instant.now()
        ));
    }

    private static AnomalyKind kindOf(String key) {
        for (AnomalyKind kind : AnomalyKind.values()) {
            if (kind.metadataKey().equals(key)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown anomaly metadata key: " + key);
    }

    private static long stepOf(Map<String, Object> context) {
        Object step = context.get("step");
        return step instanceof Number n ? n.longValue() : -1L;
    }

    private static List<Double> lossWindowOf(Map<String, Object> context) {
        if (!(context.get(LossSpikeMonitor.LOSS_WINDOW_KEY) instanceof List<?> window)) {
            return List.of();
        }
        return window.stream()
                .map(loss -> ((Number) loss).doubleValue())
                .toList();
    }
}
