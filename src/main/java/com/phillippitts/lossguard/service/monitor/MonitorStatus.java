package com.phillippitts.lossguard.service.monitor;

import com.phillippitts.lossguard.domain.AnomalyKind;
import com.phillippitts.lossguard.domain.StepOutcome;

/**
 * Read-only snapshot of a monitor's state.
 *
 * @param coordinator whether this process runs detection
 * @param logOnly whether anomalies only produce diagnostics
 * @param windowSize effective window size
 * @param windowSizeCalibrated whether the window size was derived from the run length
 * @param lossCap effective loss cap
 * @param lossCapCalibrated whether the loss cap was derived from the first full window
 * @param windowFill number of losses currently in the window
 * @param outlierCounter current consecutive-outlier streak
 * @param stepsObserved number of steps fed to the monitor
 * @param lastStep index of the last step, or -1 before the first one
 * @param lastOutcome outcome of the last step (nullable)
 * @param lastAnomaly most recent anomaly detected (nullable)
 * @param terminated whether a terminal condition has been raised
 */
public record MonitorStatus(
        boolean coordinator,
        boolean logOnly,
        int windowSize,
        boolean windowSizeCalibrated,
        double lossCap,
        boolean lossCapCalibrated,
        int windowFill,
        int outlierCounter,
        long stepsObserved,
        long lastStep,
        StepOutcome lastOutcome,
        AnomalyKind lastAnomaly,
        boolean terminated
) {}
