package com.changedetection.fusion;

import com.changedetection.changeSignal.ChangeMap;
import com.changedetection.changeSignal.SignalType;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Getter
public final class FusionResult {
    private final ChangeMap map;
    /** Sum of the weights of the signals that actually entered the average. */
    private final double weightSum;
    private final List<SignalType> fusedSignals;
    private final Map<SignalType, String> unavailableSignals;

    FusionResult(ChangeMap map, double weightSum, List<SignalType> fusedSignals,
                 Map<SignalType, String> unavailableSignals) {
        this.map = map;
        this.weightSum = weightSum;
        this.fusedSignals = Collections.unmodifiableList(fusedSignals);
        this.unavailableSignals = Collections.unmodifiableMap(unavailableSignals.isEmpty()
                ? new EnumMap<>(SignalType.class) : new EnumMap<>(unavailableSignals));
    }
}
