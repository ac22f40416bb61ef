package com.changedetection.fusion;

import com.changedetection.changeSignal.ChangeMap;
import com.changedetection.changeSignal.SignalOutcome;
import com.changedetection.changeSignal.SignalType;
import com.changedetection.exception.ChangeDetectionException;
import com.changedetection.exception.DimensionMismatchException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted average of the available change signals. The divisor is the sum of the weights of
 * the signals that were actually fused, so a missing signal only removes its own weight.
 */
@Slf4j
public class FusionEngine {

    public FusionResult fuse(Map<SignalType, SignalOutcome> outcomes, FusionWeights weights) {
        return fuse(outcomes, weights, true);
    }

    /**
     * @param renormalize min-max rescale the weighted average to [0,1]
     * @throws ChangeDetectionException when no signal with a positive weight is available
     */
    public FusionResult fuse(Map<SignalType, SignalOutcome> outcomes, FusionWeights weights, boolean renormalize) {
        double[] sum = null;
        int width = 0, height = 0;
        double weightSum = 0;
        List<SignalType> fused = new ArrayList<>();
        Map<SignalType, String> unavailable = new EnumMap<>(SignalType.class);

        for (SignalOutcome outcome : outcomes.values()) {
            SignalType type = outcome.getType();
            if (!outcome.isAvailable()) {
                unavailable.put(type, outcome.getReason());
                continue;
            }
            double weight = weights.get(type);
            if (weight <= 0) continue;

            ChangeMap map = outcome.getSignal().getMap();
            if (sum == null) {
                width = map.getWidth();
                height = map.getHeight();
                sum = new double[map.size()];
            } else if (map.getWidth() != width || map.getHeight() != height) {
                throw new DimensionMismatchException(width + "x" + height, map.getWidth() + "x" + map.getHeight());
            }
            for (int i = 0; i < sum.length; i++) sum[i] += weight * map.get(i);
            weightSum += weight;
            fused.add(type);
        }

        if (sum == null) {
            throw new ChangeDetectionException("No change signal could be fused (unavailable: " + unavailable + ")");
        }
        for (int i = 0; i < sum.length; i++) sum[i] /= weightSum;

        ChangeMap map;
        if (renormalize) {
            map = ChangeMap.normalize(width, height, sum);
        } else {
            float[] values = new float[sum.length];
            for (int i = 0; i < sum.length; i++) values[i] = (float) sum[i];
            map = ChangeMap.of(width, height, values);
        }
        log.debug("Fused {} with weight sum {}, unavailable {}", fused, weightSum, unavailable.keySet());
        return new FusionResult(map, weightSum, fused, unavailable);
    }
}
