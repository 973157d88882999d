package com.phillippitts.lossguard.service.monitor;

import com.phillippitts.lossguard.service.monitor.calibration.LossCalibrator;

/**
 * Immutable monitor configuration.
 *
 * <p>{@code windowSize} and {@code lossCap} are nullable: {@code null} means "not configured by
 * the user", which enables their one-time calibration.
 *
 * @param logOnly only report anomalies, never raise terminal conditions
 * @param patience consecutive outliers tolerated before a spike is declared
 * @param outlierMultiplier multiple of the running average that makes a loss an outlier
 * @param windowSize rolling window size, or {@code null} for auto
 * @param lossCap high-loss threshold, or {@code null} for auto
 * @param minWindowSize floor of the calibrated window size
 * @param windowFraction share of planned steps covered by the calibrated window
 * @param maxLossCap upper bound of the calibrated loss cap
 */
public record MonitorSettings(
        boolean logOnly,
        int patience,
        double outlierMultiplier,
        Integer windowSize,
        Double lossCap,
        int minWindowSize,
        double windowFraction,
        double maxLossCap
) {

    public static final boolean DEFAULT_LOG_ONLY = true;
    public static final int DEFAULT_PATIENCE = 4;
    public static final double DEFAULT_OUTLIER_MULTIPLIER = 2.0;

    public MonitorSettings {
        if (patience < 0) {
            throw new IllegalArgumentException("patience must be >= 0, was " + patience);
        }
        if (!(outlierMultiplier > 1.0)) {
            throw new IllegalArgumentException("outlierMultiplier must be > 1, was " + outlierMultiplier);
        }
        if (windowSize != null && windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, was " + windowSize);
        }
        if (lossCap != null && !(lossCap > 0.0)) {
            throw new IllegalArgumentException("lossCap must be positive, was " + lossCap);
        }
    }

    public static MonitorSettings defaults() {
        return new MonitorSettings(DEFAULT_LOG_ONLY, DEFAULT_PATIENCE, DEFAULT_OUTLIER_MULTIPLIER, null, null,
                LossCalibrator.DEFAULT_MIN_WINDOW_SIZE, LossCalibrator.DEFAULT_WINDOW_FRACTION,
                LossCalibrator.DEFAULT_MAX_LOSS_CAP);
    }

    public boolean isWindowSizeUserDefined() {
        return windowSize != null;
    }

    public boolean isLossCapUserDefined() {
        return lossCap != null;
    }

    public MonitorSettings withLogOnly(boolean value) {
        return new MonitorSettings(value, patience, outlierMultiplier, windowSize, lossCap,
                minWindowSize, windowFraction, maxLossCap);
    }

    public MonitorSettings withPatience(int value) {
        return new MonitorSettings(logOnly, value, outlierMultiplier, windowSize, lossCap,
                minWindowSize, windowFraction, maxLossCap);
    }

    public MonitorSettings withOutlierMultiplier(double value) {
        return new MonitorSettings(logOnly, patience, value, windowSize, lossCap,
                minWindowSize, windowFraction, maxLossCap);
    }

    public MonitorSettings withWindowSize(Integer value) {
        return new MonitorSettings(logOnly, patience, outlierMultiplier, value, lossCap,
                minWindowSize, windowFraction, maxLossCap);
    }

    public MonitorSettings withLossCap(Double value) {
        return new MonitorSettings(logOnly, patience, outlierMultiplier, windowSize, value,
                minWindowSize, windowFraction, maxLossCap);
    }

    LossCalibrator calibrator() {
        return new LossCalibrator(minWindowSize, windowFraction, maxLossCap);
    }
}
