package com.phillippitts.lossguard.exception;

import com.phillippitts.lossguard.domain.AnomalyKind;

/**
 * Thrown when at least half of the rolling window exceeded the loss cap
 * after the initial buffer period.
 */
public class HighLossException extends TerminalRunException {

    private final double lossCap;
    private final int windowSize;

    public HighLossException(double lossCap, int windowSize) {
        super(AnomalyKind.HIGH_LOSS, "Training stopped due to consistently high losses. The training loss exceeded "
                + "the threshold of " + lossCap + " for more than half of the " + windowSize
                + " most recent training steps. Please try submitting the run again with a lower learning rate.");
        this.lossCap = lossCap;
        this.windowSize = windowSize;
    }

    public double getLossCap() {
        return lossCap;
    }

    public int getWindowSize() {
        return windowSize;
    }
}
