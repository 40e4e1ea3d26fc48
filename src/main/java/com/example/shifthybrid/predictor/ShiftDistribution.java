package com.example.shifthybrid.predictor;

import com.example.shifthybrid.schedule.ShiftValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Probability per shift value for one cell. Missing values have probability zero.
 */
public record ShiftDistribution(Map<ShiftValue, Double> probabilities) {

    public ShiftDistribution {
        EnumMap<ShiftValue, Double> copy = new EnumMap<>(ShiftValue.class);
        if (probabilities != null) {
            copy.putAll(probabilities);
        }
        probabilities = Collections.unmodifiableMap(copy);
    }

    public static ShiftDistribution certain(ShiftValue value) {
        return new ShiftDistribution(Map.of(value, 1.0));
    }

    public double probability(ShiftValue value) {
        return probabilities.getOrDefault(value, 0.0);
    }

    /** Most probable value; ties go to the value declared first in {@link ShiftValue}. */
    public ShiftValue argmax() {
        ShiftValue best = null;
        double bestProbability = Double.NEGATIVE_INFINITY;
        for (ShiftValue value : ShiftValue.values()) {
            double p = probability(value);
            if (p > bestProbability) {
                best = value;
                bestProbability = p;
            }
        }
        return best;
    }

    /** True when every probability is a finite number in [0,1] and at least one is positive. */
    public boolean wellFormed() {
        boolean positive = false;
        for (double p : probabilities.values()) {
            if (Double.isNaN(p) || p < 0 || p > 1) {
                return false;
            }
            positive |= p > 0;
        }
        return positive;
    }
}
