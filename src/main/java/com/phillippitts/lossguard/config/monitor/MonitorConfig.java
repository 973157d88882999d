package com.phillippitts.lossguard.config.monitor;

import com.phillippitts.lossguard.config.properties.LossSpikeProperties;
import com.phillippitts.lossguard.config.properties.RunProperties;
import com.phillippitts.lossguard.service.metrics.LossMonitorMetrics;
import com.phillippitts.lossguard.service.metrics.MonitorMetricsPublisher;
import com.phillippitts.lossguard.service.monitor.LossSpikeMonitor;
import com.phillippitts.lossguard.service.monitor.LossSpikeMonitorBuilder;
import com.phillippitts.lossguard.service.telemetry.EventPublishingMetadataSink;
import com.phillippitts.lossguard.service.telemetry.LoggingMetadataSink;
import com.phillippitts.lossguard.service.telemetry.TelemetryDestination;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the loss spike monitor and its telemetry destinations.
 *
 * <p>The coordinator flag is resolved here, once, from {@code lossguard.run.global-rank}.
 */
@Configuration
public class MonitorConfig {

    @Bean
    public LoggingMetadataSink loggingMetadataSink() {
        return new LoggingMetadataSink();
    }

    @Bean
    public EventPublishingMetadataSink eventPublishingMetadataSink(ApplicationEventPublisher publisher) {
        return new EventPublishingMetadataSink(publisher);
    }

    @Bean
    public MonitorMetricsPublisher monitorMetricsPublisher(LossMonitorMetrics metrics) {
        return new MonitorMetricsPublisher(metrics);
    }

    @Bean
    public LossSpikeMonitor lossSpikeMonitor(LossSpikeProperties spikeProperties,
                                             RunProperties runProperties,
                                             List<TelemetryDestination> destinations,
                                             MonitorMetricsPublisher metricsPublisher) {
        return LossSpikeMonitorBuilder.builder()
                .settings(spikeProperties.toSettings())
                .coordinator(runProperties.isCoordinator())
                .destinations(destinations)
                .metricsPublisher(metricsPublisher)
                .build();
    }
}
