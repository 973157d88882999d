package com.phillippitts.lossguard.domain;

import com.phillippitts.lossguard.exception.InvalidLossException;

import java.util.Arrays;
import java.util.List;

/**
 * The loss reported by the host for one training step.
 *
 * <p>Hosts may report several loss components (e.g. one per objective); only a single
 * scalar can be monitored, so {@link #scalar()} rejects anything else.
 */
public final class StepLoss {

    private final double[] components;

    private StepLoss(double[] components) {
        this.components = components;
    }

    public static StepLoss of(double loss) {
        return new StepLoss(new double[]{loss});
    }

    public static StepLoss ofComponents(double... components) {
        if (components == null) {
            throw new InvalidLossException("loss is null");
        }
        return new StepLoss(components.clone());
    }

    /**
     * Builds a step loss from a list of components, as received from JSON payloads.
     *
     * @throws InvalidLossException if the list or any component is null
     */
    public static StepLoss ofComponents(List<Double> components) {
        if (components == null) {
            throw new InvalidLossException("loss is null");
        }
        double[] values = new double[components.size()];
        for (int i = 0; i < values.length; i++) {
            Double value = components.get(i);
            if (value == null) {
                throw new InvalidLossException(values.length, "component " + i + " is null");
            }
            values[i] = value;
        }
        return new StepLoss(values);
    }

    public int componentCount() {
        return components.length;
    }

    /**
     * Returns the single loss value.
     *
     * @throws InvalidLossException if there is not exactly one component, or it is not finite
     */
    public double scalar() {
        if (components.length != 1) {
            throw new InvalidLossException(components.length, "Multiple losses not supported yet");
        }
        double value = components[0];
        if (!Double.isFinite(value)) {
            throw new InvalidLossException(1, "loss must be finite but was " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "StepLoss" + Arrays.toString(components);
    }
}
