/**
 * Loss spike and persistent high loss detection.
 *
 * <p>{@link com.phillippitts.lossguard.service.monitor.LossSpikeMonitor} is the entry point; the
 * host calls it once at run start and once per completed training step. Sub-packages hold its
 * parts:
 * <ul>
 *   <li>{@code window} - bounded rolling window of recent losses</li>
 *   <li>{@code calibration} - one-shot window size and loss cap derivation</li>
 *   <li>{@code detector} - spike state machine and high-loss check</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.lossguard.service.monitor;
