package com.phillippitts.lossguard.presentation.exception;

import com.phillippitts.lossguard.exception.InvalidLossException;
import com.phillippitts.lossguard.exception.TerminalRunException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Terminal run conditions are marked non-retryable so the reporting job stops.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - the reported loss is not a single finite scalar (HTTP 400).
     */
    @ExceptionHandler(InvalidLossException.class)
    ResponseEntity<ApiError> handleInvalidLoss(InvalidLossException ex) {
        LOG.warn("Invalid loss: components={}, reason={}", ex.getComponentCount(), ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid training loss",
                ex.getMessage(),
                true,
                Instant.now()
            ));
    }

    /**
     * Malformed request body (HTTP 400).
     */
    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Rejected malformed request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "BadRequest",
                "Malformed request",
                "Expected a step index and a loss array",
                true,
                Instant.now()
            ));
    }

    /**
     * The run must stop and must not be retried (HTTP 409).
     */
    @ExceptionHandler(TerminalRunException.class)
    ResponseEntity<ApiError> handleTerminalRun(TerminalRunException ex) {
        LOG.error("Terminal run condition: kind={}, {}", ex.getKind(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Run must be stopped",
                ex.getMessage(),
                ex.isRetryable(),
                Instant.now()
            ));
    }

    /**
     * Call out of order, e.g. run start after the first step (HTTP 409).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleIllegalState(IllegalStateException ex) {
        LOG.warn("Rejected out-of-order call: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Request conflicts with monitor state",
                ex.getMessage(),
                false,
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                true,
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        boolean retryable,
        Instant timestamp
    ) {}
}
