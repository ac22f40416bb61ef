package com.changedetection.fusion;

import com.changedetection.changeSignal.SignalType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Non-negative weight per signal. Immutable; {@link #with} returns a modified copy.
 */
public final class FusionWeights {
    private final Map<SignalType, Double> weights;

    private FusionWeights(Map<SignalType, Double> weights) {
        this.weights = weights;
    }

    /**
     * Pixel difference, SSIM and spectral angle at 1.0, edge and texture change at 0.5.
     */
    public static FusionWeights defaults() {
        Map<SignalType, Double> weights = new EnumMap<>(SignalType.class);
        for (SignalType type : SignalType.values()) weights.put(type, type.getDefaultWeight());
        return new FusionWeights(weights);
    }

    public FusionWeights with(SignalType type, double weight) {
        if (!(weight >= 0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("Weight for " + type + " must be finite and >= 0: " + weight);
        }
        Map<SignalType, Double> copy = new EnumMap<>(weights);
        copy.put(type, weight);
        return new FusionWeights(copy);
    }

    public double get(SignalType type) {
        return weights.get(type);
    }

    public double sum() {
        double sum = 0;
        for (double w : weights.values()) sum += w;
        return sum;
    }

    public Map<SignalType, Double> asMap() {
        return Collections.unmodifiableMap(weights);
    }

    @Override
    public String toString() {
        return weights.toString();
    }
}
