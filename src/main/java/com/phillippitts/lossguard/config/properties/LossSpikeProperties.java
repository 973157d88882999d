package com.phillippitts.lossguard.config.properties;

import com.phillippitts.lossguard.service.monitor.MonitorSettings;
import com.phillippitts.lossguard.service.monitor.calibration.LossCalibrator;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Loss spike detection settings.
 *
 * <p>Leave {@code window-size} and {@code loss-cap} unset to have them calibrated from the run:
 * the window from the planned run length, the cap from the first full window.
 *
 * <p>Note: Bean created via {@link com.phillippitts.lossguard.LossGuardApplication}'s
 * {@code @EnableConfigurationProperties}.
 */
@ConfigurationProperties(prefix = "lossguard.spike")
@Validated
public class LossSpikeProperties {

    /** Only log anomalies; never stop the run. */
    private boolean logOnly = MonitorSettings.DEFAULT_LOG_ONLY;

    /** Consecutive outliers tolerated before a spike is declared. */
    @PositiveOrZero(message = "Patience must not be negative")
    private int patience = MonitorSettings.DEFAULT_PATIENCE;

    /** A loss at least this multiple of the running average is an outlier. */
    @DecimalMin(value = "1", inclusive = false, message = "Outlier multiplier must be greater than 1")
    private double outlierMultiplier = MonitorSettings.DEFAULT_OUTLIER_MULTIPLIER;

    /** Rolling window size; unset for auto. */
    @Min(value = 1, message = "Window size must be at least 1")
    private Integer windowSize;

    /** Persistent high loss threshold; unset for auto. */
    @Positive(message = "Loss cap must be positive")
    private Double lossCap;

    @Min(value = 1, message = "Minimum window size must be at least 1")
    private int minWindowSize = LossCalibrator.DEFAULT_MIN_WINDOW_SIZE;

    @DecimalMin(value = "0", inclusive = false, message = "Window fraction must be positive")
    @DecimalMax(value = "1", message = "Window fraction must not exceed 1")
    private double windowFraction = LossCalibrator.DEFAULT_WINDOW_FRACTION;

    @Positive(message = "Maximum loss cap must be positive")
    private double maxLossCap = LossCalibrator.DEFAULT_MAX_LOSS_CAP;

    public MonitorSettings toSettings() {
        return new MonitorSettings(logOnly, patience, outlierMultiplier, windowSize, lossCap,
                minWindowSize, windowFraction, maxLossCap);
    }

    public boolean isLogOnly() {
        return logOnly;
    }

    public void setLogOnly(boolean logOnly) {
        this.logOnly = logOnly;
    }

    public int getPatience() {
        return patience;
    }

    public void setPatience(int patience) {
        this.patience = patience;
    }

    public double getOutlierMultiplier() {
        return outlierMultiplier;
    }

    public void setOutlierMultiplier(double outlierMultiplier) {
        this.outlierMultiplier = outlierMultiplier;
    }

    public Integer getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(Integer windowSize) {
        this.windowSize = windowSize;
    }

    public Double getLossCap() {
        return lossCap;
    }

    public void setLossCap(Double lossCap) {
        this.lossCap = lossCap;
    }

    public int getMinWindowSize() {
        return minWindowSize;
    }

    public void setMinWindowSize(int minWindowSize) {
        this.minWindowSize = minWindowSize;
    }

    public double getWindowFraction() {
        return windowFraction;
    }

    public void setWindowFraction(double windowFraction) {
        this.windowFraction = windowFraction;
    }

    public double getMaxLossCap() {
        return maxLossCap;
    }

    public void setMaxLossCap(double maxLossCap) {
        this.maxLossCap = maxLossCap;
    }
}
