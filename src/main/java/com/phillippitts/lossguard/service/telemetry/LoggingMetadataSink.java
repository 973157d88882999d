package com.phillippitts.lossguard.service.telemetry;

import com.phillippitts.lossguard.service.monitor.LossSpikeMonitor;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes anomaly diagnostics to the application log.
 *
 * <p>The metadata key and the step are added to Log4j2's ThreadContext for the duration of
 * the log call ({@code anomaly}, {@code step}), so structured layouts can index them.
 * The loss window is summarized as its size and its last {@value #WINDOW_TAIL} values.
 */
public class LoggingMetadataSink implements MetadataSink {

    private static final Logger LOG = LogManager.getLogger(LoggingMetadataSink.class);

    static final int WINDOW_TAIL = 5;

    @Override
    public void record(String key, String message, Map<String, Object> context) {
        Map<String, Object> summary = new LinkedHashMap<>(context);
        Object window = summary.remove(LossSpikeMonitor.LOSS_WINDOW_KEY);
        List<?> losses = window instanceof List<?> list ? list : List.of();
        List<?> tail = losses.subList(Math.max(0, losses.size() - WINDOW_TAIL), losses.size());

        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("anomaly", key)
                .put("step", String.valueOf(context.get("step")))) {
            LOG.warn("{}: {} context={} lossWindow(size={}, last={})", key, message, summary, losses.size(), tail);
        }
    }
}
