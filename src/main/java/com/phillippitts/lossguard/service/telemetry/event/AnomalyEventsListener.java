package com.phillippitts.lossguard.service.telemetry.event;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing summary of loss anomalies. Throttled per anomaly kind, since a spike keeps
 * being reported on every step of the streak.
 */
@Component
class AnomalyEventsListener {
    private static final Logger LOG = LogManager.getLogger(AnomalyEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onLossAnomaly(LossAnomalyEvent e) {
        if (shouldLog(e.kind().metadataKey())) {
            LOG.warn("Loss anomaly: kind={}, step={}, windowSize={}. {}",
                    e.kind(), e.step(), e.lossWindow().size(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
