package com.phillippitts.lossguard.config.properties;

import com.phillippitts.lossguard.domain.RunPlan;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the monitored run: its planned length and this process's rank.
 */
@ConfigurationProperties(prefix = "lossguard.run")
@Validated
public class RunProperties {

    /** Explicit step budget; wins over epochs * steps-per-epoch. */
    private Long maxDurationSteps;

    private Integer epochs;

    private Long stepsPerEpoch;

    /** Global rank of this process; rank 0 runs detection. */
    @PositiveOrZero(message = "Global rank must not be negative")
    private int globalRank = 0;

    public RunPlan toRunPlan() {
        return new RunPlan(maxDurationSteps, epochs, stepsPerEpoch);
    }

    public boolean isCoordinator() {
        return globalRank == 0;
    }

    public Long getMaxDurationSteps() {
        return maxDurationSteps;
    }

    public void setMaxDurationSteps(Long maxDurationSteps) {
        this.maxDurationSteps = maxDurationSteps;
    }

    public Integer getEpochs() {
        return epochs;
    }

    public void setEpochs(Integer epochs) {
        this.epochs = epochs;
    }

    public Long getStepsPerEpoch() {
        return stepsPerEpoch;
    }

    public void setStepsPerEpoch(Long stepsPerEpoch) {
        this.stepsPerEpoch = stepsPerEpoch;
    }

    public int getGlobalRank() {
        return globalRank;
    }

    public void setGlobalRank(int globalRank) {
        this.globalRank = globalRank;
    }
}
