package com.phillippitts.lossguard.service.monitor.calibration;

import java.util.List;
import java.util.OptionalLong;

/**
 * One-shot derivation of the rolling window size and of the high-loss cap.
 *
 * <p>Both values are only derived when the user did not configure them explicitly:
 * <ul>
 *   <li>window size: {@code max(minimum, round(totalPlannedSteps * fraction))}, computed once at run start</li>
 *   <li>loss cap: {@code min(max(firstFullWindow), hardMaximum)}, computed once when the window first fills</li>
 * </ul>
 *
 * <p>Rounding is half-to-even, so a run of 2,010 steps at 5% yields a window of 100, not 101.
 */
public final class LossCalibrator {

    public static final int DEFAULT_MIN_WINDOW_SIZE = 100;
    public static final double DEFAULT_WINDOW_FRACTION = 0.05;
    public static final double DEFAULT_MAX_LOSS_CAP = 10.0;

    private final int minWindowSize;
    private final double windowFraction;
    private final double maxLossCap;

    public LossCalibrator() {
        this(DEFAULT_MIN_WINDOW_SIZE, DEFAULT_WINDOW_FRACTION, DEFAULT_MAX_LOSS_CAP);
    }

    public LossCalibrator(int minWindowSize, double windowFraction, double maxLossCap) {
        if (minWindowSize < 1) {
            throw new IllegalArgumentException("minWindowSize must be >= 1, was " + minWindowSize);
        }
        if (!(windowFraction > 0.0 && windowFraction <= 1.0)) {
            throw new IllegalArgumentException("windowFraction must be in (0, 1], was " + windowFraction);
        }
        if (!(maxLossCap > 0.0)) {
            throw new IllegalArgumentException("maxLossCap must be positive, was " + maxLossCap);
        }
        this.minWindowSize = minWindowSize;
        this.windowFraction = windowFraction;
        this.maxLossCap = maxLossCap;
    }

    public int minWindowSize() {
        return minWindowSize;
    }

    public double maxLossCap() {
        return maxLossCap;
    }

    public int windowSizeFor(OptionalLong totalPlannedSteps) {
        if (totalPlannedSteps.isEmpty()) {
            return minWindowSize;
        }
        return computeWindowSize(totalPlannedSteps.getAsLong(), minWindowSize, windowFraction);
    }

    public double lossCapFor(List<Double> firstFullWindow) {
        return computeLossCap(firstFullWindow, maxLossCap);
    }

    /**
     * Window size for a run of {@code totalPlannedSteps} steps.
     *
     * @param totalPlannedSteps estimated total steps; non-positive means unknown
     * @param minimum floor for the result
     * @param fraction share of the run covered by the window
     * @return {@code max(minimum, round(totalPlannedSteps * fraction))}, at most {@link Integer#MAX_VALUE}
     */
    public static int computeWindowSize(long totalPlannedSteps, int minimum, double fraction) {
        if (totalPlannedSteps <= 0) {
            return minimum;
        }
        double scaled = Math.rint(totalPlannedSteps * fraction);
        if (scaled >= Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return Math.max(minimum, (int) scaled);
    }

    /**
     * Loss cap derived from the first full window.
     *
     * @throws IllegalArgumentException if the window is empty
     */
    public static double computeLossCap(List<Double> firstFullWindow, double hardMaximum) {
        if (firstFullWindow == null || firstFullWindow.isEmpty()) {
            throw new IllegalArgumentException("Cannot calibrate loss cap from an empty window");
        }
        double max = Double.NEGATIVE_INFINITY;
        for (double loss : firstFullWindow) {
            max = Math.max(max, loss);
        }
        return Math.min(max, hardMaximum);
    }
}
