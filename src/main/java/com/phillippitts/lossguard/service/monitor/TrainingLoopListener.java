package com.phillippitts.lossguard.service.monitor;

import com.phillippitts.lossguard.domain.RunLengthAccessor;
import com.phillippitts.lossguard.domain.StepLoss;
import com.phillippitts.lossguard.domain.StepOutcome;

/**
 * Callbacks a training loop invokes on its monitors.
 *
 * <p>Calls are synchronous and inline with the training step: {@link #onRunStart} once before
 * the first step, then {@link #onBatchEnd} once per step.
 */
public interface TrainingLoopListener {

    /**
     * Called once when the run starts, before the first step.
     *
     * @param runLength estimate of the planned run length
     */
    default void onRunStart(RunLengthAccessor runLength) {}

    /**
     * Called when a training step completes.
     *
     * @param step index of the step (0-based count of previously completed steps)
     * @param loss the step's loss
     * @return what the listener concluded for this step
     */
    StepOutcome onBatchEnd(long step, StepLoss loss);
}
