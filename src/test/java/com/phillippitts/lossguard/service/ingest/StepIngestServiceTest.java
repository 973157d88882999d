package com.phillippitts.lossguard.service.ingest;

import com.phillippitts.lossguard.domain.RunPlan;
import com.phillippitts.lossguard.domain.StepLoss;
import com.phillippitts.lossguard.domain.StepOutcome;
import com.phillippitts.lossguard.service.monitor.LossSpikeMonitorBuilder;
import com.phillippitts.lossguard.service.monitor.MonitorSettings;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class StepIngestServiceTest {

    @Test
    void delegatesToMonitor() {
        StepIngestService service = new StepIngestService(LossSpikeMonitorBuilder.builder()
                .settings(MonitorSettings.defaults())
                .build());

        service.startRun(RunPlan.ofSteps(4_000));

        assertThat(service.status().windowSize()).isEqualTo(200);
        assertThat(service.recordStep(0, StepLoss.of(2.0))).isEqualTo(StepOutcome.WARMING_UP);
        assertThat(service.status().stepsObserved()).isEqualTo(1);
        assertThat(service.status().lastStep()).isZero();
    }

    @Test
    void serializesConcurrentReports() throws InterruptedException {
        StepIngestService service = new StepIngestService(LossSpikeMonitorBuilder.builder()
                .settings(MonitorSettings.defaults().withWindowSize(1_000))
                .build());
        int threads = 8;
        int stepsPerThread = 100;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger warmingUp = new AtomicInteger();
        try {
            for (int t = 0; t < threads; t++) {
                int offset = t * stepsPerThread;
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < stepsPerThread; i++) {
                        if (service.recordStep(offset + i, StepLoss.of(1.0)) == StepOutcome.WARMING_UP) {
                            warmingUp.incrementAndGet();
                        }
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }

        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(service.status().stepsObserved()).isEqualTo(800);
        assertThat(service.status().windowFill()).isEqualTo(800);
        assertThat(warmingUp.get()).isEqualTo(800);
    }
}
