package com.phillippitts.lossguard.presentation.controller;

import com.phillippitts.lossguard.config.properties.RunProperties;
import com.phillippitts.lossguard.domain.RunPlan;
import com.phillippitts.lossguard.domain.StepLoss;
import com.phillippitts.lossguard.domain.StepOutcome;
import com.phillippitts.lossguard.service.ingest.StepIngestService;
import com.phillippitts.lossguard.service.monitor.MonitorStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * HTTP entry point for training jobs that report their loss remotely.
 *
 * <ul>
 *   <li>{@code POST /api/v1/monitor/run-start} - optional run plan; falls back to {@code lossguard.run.*}</li>
 *   <li>{@code POST /api/v1/monitor/steps} - one step: {@code {"step": 12, "loss": [2.31]}};
 *       answers {@code {"step", "outcome", "anomaly"}}</li>
 *   <li>{@code GET /api/v1/monitor/status} - current monitor state</li>
 * </ul>
 *
 * <p>A terminal anomaly is answered with 409 and {@code retryable=false}; the job should stop.
 */
@RestController
@RequestMapping("/api/v1/monitor")
class RunMonitorController {

    private static final Logger LOG = LogManager.getLogger(RunMonitorController.class);

    private final StepIngestService ingestService;
    private final RunProperties runProperties;

    RunMonitorController(StepIngestService ingestService, RunProperties runProperties) {
        this.ingestService = ingestService;
        this.runProperties = runProperties;
    }

    @PostMapping("/run-start")
    ResponseEntity<MonitorStatus> startRun(@RequestBody(required = false) RunPlan plan) {
        RunPlan effectivePlan = plan != null ? plan : runProperties.toRunPlan();
        LOG.info("Run start reported: plan={}", effectivePlan);
        ingestService.startRun(effectivePlan);
        return ResponseEntity.ok(ingestService.status());
    }

    @PostMapping("/steps")
    ResponseEntity<Map<String, Object>> recordStep(@Valid @RequestBody StepRequest request) {
        try (CloseableThreadContext.Instance ignored =
                     CloseableThreadContext.put("step", String.valueOf(request.step()))) {
            StepOutcome outcome = ingestService.recordStep(request.step(), StepLoss.ofComponents(request.loss()));
            return ResponseEntity.ok(Map.of(
                    "step", request.step(),
                    "outcome", outcome,
                    "anomaly", outcome.isAnomaly()
            ));
        }
    }

    @GetMapping("/status")
    ResponseEntity<MonitorStatus> status() {
        return ResponseEntity.ok(ingestService.status());
    }

    /**
     * One reported training step.
     *
     * @param step 0-based step index
     * @param loss loss components; exactly one is supported
     */
    public record StepRequest(
            @NotNull @PositiveOrZero Long step,
            @NotNull List<Double> loss
    ) {}
}
