/**
 * Domain values exchanged between the training host and the monitor.
 *
 * <p>Key types:
 * <ul>
 *   <li>{@link com.phillippitts.lossguard.domain.StepLoss} - per-step loss as reported by the host</li>
 *   <li>{@link com.phillippitts.lossguard.domain.RunPlan} - run-length settings used to size the window</li>
 *   <li>{@link com.phillippitts.lossguard.domain.StepOutcome} - what the monitor concluded for a step</li>
 *   <li>{@link com.phillippitts.lossguard.domain.AnomalyKind} - loss spike or persistently high loss</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.lossguard.domain;
