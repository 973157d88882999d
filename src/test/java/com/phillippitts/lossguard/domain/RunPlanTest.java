package com.phillippitts.lossguard.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RunPlanTest {

    @Test
    void explicitStepBudgetWins() {
        RunPlan plan = new RunPlan(5_000L, 10, 1_000L);

        assertThat(plan.totalPlannedSteps()).hasValue(5_000L);
    }

    @Test
    void multipliesEpochsBySteps() {
        assertThat(RunPlan.ofEpochs(3, 700).totalPlannedSteps()).hasValue(2_100L);
    }

    @Test
    void missingValuesMeanUnknown() {
        assertThat(new RunPlan(null, null, null).totalPlannedSteps()).isEmpty();
        assertThat(new RunPlan(null, 3, null).totalPlannedSteps()).isEmpty();
        assertThat(new RunPlan(0L, null, null).totalPlannedSteps()).isEmpty();
        assertThat(RunLengthAccessor.UNKNOWN.totalPlannedSteps()).isEmpty();
    }

    @Test
    void overflowSaturates() {
        assertThat(RunPlan.ofEpochs(Integer.MAX_VALUE, Long.MAX_VALUE / 2).totalPlannedSteps())
                .hasValue(Long.MAX_VALUE);
    }
}
