package com.phillippitts.lossguard.exception;

/**
 * Base exception for all loss-guard application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class LossGuardException extends RuntimeException {

    public LossGuardException(String message) {
        super(message);
    }

    public LossGuardException(String message, Throwable cause) {
        super(message, cause);
    }

    public LossGuardException(Throwable cause) {
        super(cause);
    }
}
