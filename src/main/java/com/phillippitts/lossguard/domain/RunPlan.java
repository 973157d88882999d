package com.phillippitts.lossguard.domain;

import java.util.OptionalLong;

/**
 * Run-length configuration of a training run.
 *
 * <p>An explicit step budget wins over {@code epochs * stepsPerEpoch}. Missing or
 * non-positive values mean "unknown".
 *
 * @param maxDurationSteps explicit step budget (nullable)
 * @param epochs number of epochs (nullable)
 * @param stepsPerEpoch steps in one epoch (nullable)
 */
public record RunPlan(Long maxDurationSteps, Integer epochs, Long stepsPerEpoch) implements RunLengthAccessor {

    public static RunPlan ofSteps(long maxDurationSteps) {
        return new RunPlan(maxDurationSteps, null, null);
    }

    public static RunPlan ofEpochs(int epochs, long stepsPerEpoch) {
        return new RunPlan(null, epochs, stepsPerEpoch);
    }

    @Override
    public OptionalLong totalPlannedSteps() {
        if (maxDurationSteps != null && maxDurationSteps > 0) {
            return OptionalLong.of(maxDurationSteps);
        }
        if (epochs != null && epochs > 0 && stepsPerEpoch != null && stepsPerEpoch > 0) {
            try {
                return OptionalLong.of(Math.multiplyExact(epochs.longValue(), stepsPerEpoch));
            } catch (ArithmeticException overflow) {
                return OptionalLong.of(Long.MAX_VALUE);
            }
        }
        return OptionalLong.empty();
    }
}
