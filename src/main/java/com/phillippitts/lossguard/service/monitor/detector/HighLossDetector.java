package com.phillippitts.lossguard.service.monitor.detector;

import com.phillippitts.lossguard.service.monitor.window.RollingLossWindow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Detects persistently high training loss.
 *
 * <p>Only evaluated once {@code currentStep >= 2 * windowSize}, so the window and the loss cap
 * have settled. Fires when at least {@code windowSize / 2.0} losses in the window exceed the cap;
 * for an odd window of 11 that means 6 losses, not 5.
 *
 * <p>Stateless.
 */
public final class HighLossDetector {

    private static final Logger LOG = LogManager.getLogger(HighLossDetector.class);

    /**
     * @param window losses before the current step's loss is added
     * @param currentStep index of the current step
     * @param lossCap threshold a loss must strictly exceed to count as high
     * @param windowSize configured (or calibrated) window size
     * @return {@code true} if half of the window is above the cap after the buffer period
     */
    public boolean detect(RollingLossWindow window, long currentStep, double lossCap, int windowSize) {
        if (currentStep < 2L * windowSize) {
            return false;
        }
        if (window.countExceeding(lossCap) >= windowSize / 2.0) {
            LOG.info("High losses (train loss consistently greater than {}) detected.", lossCap);
            return true;
        }
        return false;
    }
}
