/**
 * Telemetry destinations that receive anomaly diagnostics from the monitor.
 */
package com.phillippitts.lossguard.service.telemetry;
