package com.phillippitts.lossguard.exception;

import com.phillippitts.lossguard.domain.AnomalyKind;

/**
 * Thrown when more than {@code patience} consecutive training losses were outliers
 * relative to the running average of the rolling window.
 */
public class LossSpikeException extends TerminalRunException {

    private final double outlierMultiplier;
    private final double runningLossAvg;
    private final int outlierCounter;

    public LossSpikeException(double outlierMultiplier, double runningLossAvg, int outlierCounter) {
        super(AnomalyKind.LOSS_SPIKE, "Training stopped due to a loss spike. The training loss was more than "
                + outlierMultiplier + " times greater than the running average loss (approx. "
                + Math.round(Math.rint(runningLossAvg)) + ") over " + outlierCounter
                + " consecutive training steps. Please try submitting the run again with a lower learning rate.");
        this.outlierMultiplier = outlierMultiplier;
        this.runningLossAvg = runningLossAvg;
        this.outlierCounter = outlierCounter;
    }

    public double getOutlierMultiplier() {
        return outlierMultiplier;
    }

    public double getRunningLossAvg() {
        return runningLossAvg;
    }

    public int getOutlierCounter() {
        return outlierCounter;
    }
}
