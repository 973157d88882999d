package com.phillippitts.lossguard.exception;

import com.phillippitts.lossguard.domain.AnomalyKind;

/**
 * Signals that the monitored run must stop and must not be retried as-is.
 *
 * <p>Resubmitting the same run without intervention (typically a lower learning rate)
 * reproduces the same failure, so hosts should surface this to the user instead of
 * restarting automatically.
 */
public abstract class TerminalRunException extends LossGuardException {

    private final AnomalyKind kind;

    protected TerminalRunException(AnomalyKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AnomalyKind getKind() {
        return kind;
    }

    /**
     * Always {@code false}; terminal run conditions are never retryable.
     */
    public final boolean isRetryable() {
        return false;
    }
}
