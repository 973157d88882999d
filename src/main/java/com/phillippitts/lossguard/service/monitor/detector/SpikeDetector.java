package com.phillippitts.lossguard.service.monitor.detector;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Consecutive-outlier state machine.
 *
 * <p><b>States:</b>
 * <pre>
 * NORMAL   (outlierCounter == 0)
 * COUNTING (outlierCounter &gt; 0)
 * </pre>
 *
 * <p><b>Transitions</b> for a loss {@code v} against the window mean {@code m}:
 * <ul>
 *   <li>{@code v >= m * outlierMultiplier}: counter is incremented; a spike is reported while
 *       the counter exceeds {@code patience}. The counter is not reset after reporting, so the
 *       spike is reported again on every further outlier.</li>
 *   <li>otherwise: counter is reset to 0.</li>
 * </ul>
 *
 * <p>Not thread-safe; owned by a single monitor.
 */
public final class SpikeDetector {

    private static final Logger LOG = LogManager.getLogger(SpikeDetector.class);

    private final double outlierMultiplier;
    private final int patience;
    private int outlierCounter;

    public SpikeDetector(double outlierMultiplier, int patience) {
        this(outlierMultiplier, patience, 0);
    }

    // Package-private for tests: resumes from an existing outlier streak
    SpikeDetector(double outlierMultiplier, int patience, int outlierCounter) {
        if (!(outlierMultiplier > 1.0)) {
            throw new IllegalArgumentException("outlierMultiplier must be > 1, was " + outlierMultiplier);
        }
        if (patience < 0) {
            throw new IllegalArgumentException("patience must be >= 0, was " + patience);
        }
        if (outlierCounter < 0) {
            throw new IllegalArgumentException("outlierCounter must be >= 0, was " + outlierCounter);
        }
        this.outlierMultiplier = outlierMultiplier;
        this.patience = patience;
        this.outlierCounter = outlierCounter;
    }

    /**
     * Evaluates one training loss.
     *
     * @param trainLoss loss of the current step
     * @param runningLossAvg mean of the window before {@code trainLoss} is added
     * @return {@code true} while the outlier streak is longer than {@code patience}
     */
    public boolean detect(double trainLoss, double runningLossAvg) {
        if (trainLoss >= runningLossAvg * outlierMultiplier) {
            outlierCounter++;
            LOG.info("Potential loss spike detected. Iteration: {}", outlierCounter);
            if (outlierCounter > patience) {
                LOG.info("Loss spike detected for {} steps. Try lowering the learning rate.", outlierCounter);
                return true;
            }
        } else if (outlierCounter > 0) {
            LOG.info("Not a persistent loss spike. Resetting outlier counter.");
            outlierCounter = 0;
        }
        return false;
    }

    public int outlierCounter() {
        return outlierCounter;
    }
}
