package com.phillippitts.lossguard.exception;

/**
 * Thrown when the per-step loss is not a single finite scalar
 * (multiple loss components, no component at all, NaN or infinity).
 */
public class InvalidLossException extends LossGuardException {

    private final int componentCount;
    private final String reason;

    public InvalidLossException(String reason) {
        super("Invalid training loss: " + reason);
        this.componentCount = 0;
        this.reason = reason;
    }

    public InvalidLossException(int componentCount, String reason) {
        super("Invalid training loss (" + componentCount + " components): " + reason);
        this.componentCount = componentCount;
        this.reason = reason;
    }

    public int getComponentCount() {
        return componentCount;
    }

    public String getReason() {
        return reason;
    }
}
