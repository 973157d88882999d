package com.phillippitts.lossguard.service.telemetry.event;

import com.phillippitts.lossguard.domain.AnomalyKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class AnomalyEventsListenerTest {

    @Test
    void throttlesRepeatLogsPerKind() {
        AnomalyEventsListener l = new AnomalyEventsListener();

        assertThat(l.shouldLog("loss_spike")).isTrue();
        assertThat(l.shouldLog("loss_spike")).isFalse();
        // Other kinds have their own budget
        assertThat(l.shouldLog("high_loss")).isTrue();
    }

    @Test
    void handlerDoesNotThrow() {
        AnomalyEventsListener l = new AnomalyEventsListener();

        assertThatCode(() -> {
            l.onLossAnomaly(new LossAnomalyEvent(AnomalyKind.LOSS_SPIKE, 10, "spike", List.of(1.0), Instant.now()));
            l.onLossAnomaly(new LossAnomalyEvent(AnomalyKind.LOSS_SPIKE, 11, "spike", null, null));
        }).doesNotThrowAnyException();
    }

    @Test
    void eventDefaultsTimestampAndCopiesWindow() {
        LossAnomalyEvent event = new LossAnomalyEvent(AnomalyKind.HIGH_LOSS, 3, "high", List.of(12.0), null);

        assertThat(event.at()).isNotNull();
        assertThat(event.lossWindow()).containsExactly(12.0);
    }
}
