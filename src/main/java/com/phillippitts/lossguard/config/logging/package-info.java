/**
 * Logging configuration for structured logs.
 *
 * <p>{@link com.phillippitts.lossguard.config.logging.RunContextFilter} scopes Log4j2's
 * ThreadContext to the reporting run ({@code requestId}, {@code runId}, {@code endpoint});
 * {@code log4j2-spring.xml} prints them together with the {@code step} key set per step report
 * and the {@code anomaly} key set by the logging telemetry sink.
 *
 * @since 1.0
 */
package com.phillippitts.lossguard.config.logging;
