package com.phillippitts.lossguard.domain;

import java.util.OptionalLong;

/**
 * Supplies an estimate of the total number of steps planned for a run.
 */
@FunctionalInterface
public interface RunLengthAccessor {

    /** Accessor for hosts that cannot tell how long the run will be. */
    RunLengthAccessor UNKNOWN = OptionalLong::empty;

    /**
     * @return total planned steps, or empty when no reliable estimate exists
     */
    OptionalLong totalPlannedSteps();
}
