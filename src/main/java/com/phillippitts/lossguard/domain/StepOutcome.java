package com.phillippitts.lossguard.domain;

/**
 * Result of feeding one training step into the monitor.
 */
public enum StepOutcome {
    /** This process is not the coordinator; nothing was evaluated. */
    SKIPPED,
    /** The rolling window is still filling up; no detection ran. */
    WARMING_UP,
    /** Detection ran and found nothing. */
    NORMAL,
    LOSS_SPIKE,
    HIGH_LOSS;

    public boolean isAnomaly() {
        return this == LOSS_SPIKE || this == HIGH_LOSS;
    }

    public static StepOutcome of(AnomalyKind kind) {
        return kind == AnomalyKind.LOSS_SPIKE ? LOSS_SPIKE : HIGH_LOSS;
    }
}
