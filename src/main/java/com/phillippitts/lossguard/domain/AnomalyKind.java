package com.phillippitts.lossguard.domain;

/**
 * Kinds of training-loss anomaly the monitor can detect.
 *
 * <p>The metadata key is the key under which the diagnostic message is recorded on
 * structured telemetry sinks.
 */
public enum AnomalyKind {

    LOSS_SPIKE("loss_spike"),
    HIGH_LOSS("high_loss");

    private final String metadataKey;

    AnomalyKind(String metadataKey) {
        this.metadataKey = metadataKey;
    }

    public String metadataKey() {
        return metadataKey;
    }
}
