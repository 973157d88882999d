package com.phillippitts.lossguard.service.monitor.detector;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpikeDetectorTest {

    @Test
    void firstOutlierIsNotASpike() {
        SpikeDetector detector = new SpikeDetector(2.0, 4);

        assertThat(detector.detect(5.0, 2.0)).isFalse();
        assertThat(detector.outlierCounter()).isEqualTo(1);
    }

    @Test
    void reportsSpikeOnceStreakExceedsPatience() {
        SpikeDetector detector = new SpikeDetector(2.0, 4, 4);

        assertThat(detector.detect(5.0, 2.0)).isTrue();
        assertThat(detector.outlierCounter()).isEqualTo(5);
    }

    @Test
    void lossEqualToThresholdCountsAsOutlier() {
        SpikeDetector detector = new SpikeDetector(2.0, 0);

        assertThat(detector.detect(4.0, 2.0)).isTrue();
    }

    @Test
    void normalLossResetsStreak() {
        SpikeDetector detector = new SpikeDetector(2.0, 4);
        detector.detect(5.0, 2.0);
        detector.detect(5.0, 2.0);
        detector.detect(5.0, 2.0);

        assertThat(detector.detect(2.1, 2.0)).isFalse();
        assertThat(detector.outlierCounter()).isZero();

        // Streak starts over
        assertThat(detector.detect(5.0, 2.0)).isFalse();
        assertThat(detector.outlierCounter()).isEqualTo(1);
    }

    @Test
    void keepsReportingWhileStreakContinues() {
        SpikeDetector detector = new SpikeDetector(2.0, 1);
        assertThat(detector.detect(5.0, 2.0)).isFalse();

        assertThat(detector.detect(5.0, 2.0)).isTrue();
        assertThat(detector.detect(5.0, 2.0)).isTrue();
        assertThat(detector.outlierCounter()).isEqualTo(3);
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new SpikeDetector(1.0, 4)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SpikeDetector(2.0, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SpikeDetector(2.0, 1, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
