package com.phillippitts.lossguard.config.properties;

import com.phillippitts.lossguard.service.monitor.MonitorSettings;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class LossSpikePropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    void defaultsMatchMonitorDefaults() {
        LossSpikeProperties props = new LossSpikeProperties();

        assertThat(props.toSettings()).isEqualTo(MonitorSettings.defaults());
        assertThat(validator.validate(props)).isEmpty();
    }

    @Test
    void configuredValuesAreUserDefined() {
        LossSpikeProperties props = new LossSpikeProperties();
        props.setLogOnly(false);
        props.setWindowSize(250);
        props.setLossCap(4.5);

        MonitorSettings settings = props.toSettings();

        assertThat(settings.logOnly()).isFalse();
        assertThat(settings.isWindowSizeUserDefined()).isTrue();
        assertThat(settings.windowSize()).isEqualTo(250);
        assertThat(settings.isLossCapUserDefined()).isTrue();
        assertThat(settings.lossCap()).isEqualTo(4.5);
    }

    @Test
    void rejectsMultiplierNotAboveOne() {
        LossSpikeProperties props = new LossSpikeProperties();
        props.setOutlierMultiplier(1.0);

        Set<ConstraintViolation<LossSpikeProperties>> violations = validator.validate(props);

        assertThat(violations).hasSize(1);
        assertThat(violations.iterator().next().getMessage()).contains("greater than 1");
    }

    @Test
    void rejectsNegativePatienceAndEmptyWindow() {
        LossSpikeProperties props = new LossSpikeProperties();
        props.setPatience(-1);
        props.setWindowSize(0);
        props.setLossCap(0.0);
        props.setWindowFraction(1.5);

        assertThat(validator.validate(props))
                .extracting(v -> v.getPropertyPath().toString())
                .containsExactlyInAnyOrder("patience", "windowSize", "lossCap", "windowFraction");
    }

    @Test
    void runPropertiesResolveCoordinatorAndPlan() {
        RunProperties run = new RunProperties();
        run.setEpochs(2);
        run.setStepsPerEpoch(5_000L);

        assertThat(run.isCoordinator()).isTrue();
        assertThat(run.toRunPlan().totalPlannedSteps()).hasValue(10_000L);

        run.setGlobalRank(3);
        assertThat(run.isCoordinator()).isFalse();
        run.setGlobalRank(-1);
        assertThat(validator.validate(run)).hasSize(1);
    }
}
