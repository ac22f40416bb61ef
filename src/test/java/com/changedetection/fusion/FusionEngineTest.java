package com.changedetection.fusion;

import com.changedetection.changeSignal.ChangeMap;
import com.changedetection.changeSignal.ChangeSignal;
import com.changedetection.changeSignal.SignalOutcome;
import com.changedetection.changeSignal.SignalType;
import com.changedetection.exception.ChangeDetectionException;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class FusionEngineTest {
    private final FusionEngine engine = new FusionEngine();

    @Test
    public void divisorIsSumOfAllWeightsWhenEverySignalIsAvailable() {
        FusionResult result = engine.fuse(outcomes(null), FusionWeights.defaults());
        assertEquals(4.0, result.getWeightSum(), 1e-12);
        assertEquals(Arrays.asList(SignalType.values()), result.getFusedSignals());
        assertTrue(result.getUnavailableSignals().isEmpty());
    }

    @Test
    public void droppedSignalOnlyRemovesItsOwnWeight() {
        FusionWeights weights = FusionWeights.defaults();
        for (SignalType dropped : SignalType.values()) {
            FusionResult result = engine.fuse(outcomes(dropped), weights);
            assertEquals(dropped.name(), weights.sum() - weights.get(dropped), result.getWeightSum(), 1e-12);
            assertFalse(result.getFusedSignals().contains(dropped));
            assertTrue(result.getUnavailableSignals().containsKey(dropped));
        }
    }

    @Test
    public void weightedAverageWithoutRenormalisation() {
        Map<SignalType, SignalOutcome> outcomes = new EnumMap<>(SignalType.class);
        outcomes.put(SignalType.PIXEL_DIFFERENCE, available(SignalType.PIXEL_DIFFERENCE, 1f));
        outcomes.put(SignalType.EDGE_CHANGE, available(SignalType.EDGE_CHANGE, 0f));

        FusionResult result = engine.fuse(outcomes, FusionWeights.defaults(), false);

        assertEquals(1.5, result.getWeightSum(), 1e-12);
        assertEquals(1.0 / 1.5, result.getMap().get(1), 1e-6);
    }

    @Test
    public void zeroWeightSignalIsNotFused() {
        FusionWeights weights = FusionWeights.defaults().with(SignalType.TEXTURE_CHANGE, 0.0);
        FusionResult result = engine.fuse(outcomes(null), weights);
        assertEquals(3.5, result.getWeightSum(), 1e-12);
        assertFalse(result.getFusedSignals().contains(SignalType.TEXTURE_CHANGE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeWeightIsRejected() {
        FusionWeights.defaults().with(SignalType.EDGE_CHANGE, -0.5);
    }

    @Test(expected = ChangeDetectionException.class)
    public void nothingToFuse() {
        Map<SignalType, SignalOutcome> outcomes = new EnumMap<>(SignalType.class);
        outcomes.put(SignalType.SPECTRAL_ANGLE, SignalOutcome.unavailable(SignalType.SPECTRAL_ANGLE, "single band"));
        engine.fuse(outcomes, FusionWeights.defaults());
    }

    private static Map<SignalType, SignalOutcome> outcomes(SignalType dropped) {
        Map<SignalType, SignalOutcome> outcomes = new EnumMap<>(SignalType.class);
        float value = 0.1f;
        for (SignalType type : SignalType.values()) {
            outcomes.put(type, type == dropped
                    ? SignalOutcome.unavailable(type, "dropped")
                    : available(type, value));
            value += 0.2f;
        }
        return outcomes;
    }

    private static SignalOutcome available(SignalType type, float value) {
        float[] values = new float[16];
        Arrays.fill(values, value);
        values[0] = 1f;
        values[15] = 0f;
        ChangeMap map = ChangeMap.of(4, 4, values);
        return SignalOutcome.available(new ChangeSignal(type, map, Collections.<String, Double>emptyMap()));
    }
}
