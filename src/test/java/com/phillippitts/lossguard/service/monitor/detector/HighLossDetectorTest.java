package com.phillippitts.lossguard.service.monitor.detector;

import com.phillippitts.lossguard.service.monitor.window.RollingLossWindow;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HighLossDetectorTest {

    private final HighLossDetector detector = new HighLossDetector();

    @Test
    void lowLossesAreNotHigh() {
        RollingLossWindow window = windowOf(2, 2, 2, 2, 2, 2, 2, 2, 2, 2);

        assertThat(detector.detect(window, 21, 10.0, 10)).isFalse();
    }

    @Test
    void halfOfWindowAboveCapIsHighLoss() {
        RollingLossWindow window = windowOf(9, 8, 7, 6, 5, 11, 12, 13, 14, 15);

        assertThat(detector.detect(window, 21, 10.0, 10)).isTrue();
    }

    @Test
    void neverFiresBeforeBufferPeriod() {
        RollingLossWindow window = windowOf(11, 12, 13, 14, 15, 16, 17, 18, 19, 20);

        assertThat(detector.detect(window, 19, 10.0, 10)).isFalse();
        assertThat(detector.detect(window, 20, 10.0, 10)).isTrue();
    }

    @Test
    void oddWindowNeedsMoreThanHalf() {
        RollingLossWindow fiveHigh = windowOf(1, 1, 1, 1, 1, 1, 11, 11, 11, 11, 11);
        RollingLossWindow sixHigh = windowOf(1, 1, 1, 1, 1, 11, 11, 11, 11, 11, 11);

        assertThat(detector.detect(fiveHigh, 30, 10.0, 11)).isFalse();
        assertThat(detector.detect(sixHigh, 30, 10.0, 11)).isTrue();
    }

    @Test
    void lossEqualToCapIsNotHigh() {
        RollingLossWindow window = windowOf(10, 10, 10, 10);

        assertThat(detector.detect(window, 8, 10.0, 4)).isFalse();
    }

    private static RollingLossWindow windowOf(double... losses) {
        RollingLossWindow window = new RollingLossWindow(losses.length);
        for (double loss : losses) {
            window.push(loss);
        }
        return window;
    }
}
