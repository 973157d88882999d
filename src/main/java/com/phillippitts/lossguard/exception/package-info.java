/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.lossguard.exception.LossGuardException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.lossguard.exception.InvalidLossException} - Thrown when the
 *       per-step loss is not a single finite scalar</li>
 *   <li>{@link com.phillippitts.lossguard.exception.TerminalRunException} - Base of the
 *       non-retryable conditions that stop a run:
 *     <ul>
 *       <li>{@link com.phillippitts.lossguard.exception.LossSpikeException}</li>
 *       <li>{@link com.phillippitts.lossguard.exception.HighLossException}</li>
 *     </ul>
 *   </li>
 * </ul>
 *
 * <p>All exceptions are unchecked and map to HTTP status codes via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.lossguard.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.lossguard.exception;
