package com.changedetection.fusion;

import com.changedetection.changeSignal.ChangeMap;
import com.changedetection.changeSignal.ChangeMask;
import com.changedetection.changeSignal.ChangeSignal;
import com.changedetection.changeSignal.SignalType;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Final product of change detection. Pixel counts are always derived from the mask.
 */
@Getter
public final class DetectionResult {
    private final DetectionMethod method;
    private final ChangeMap map;
    private final ChangeMask mask;
    private final double threshold;
    private final long changedPixels;
    private final long totalPixels;
    private final double changePercentage;
    private final List<SignalType> fusedSignals;
    private final Map<SignalType, String> unavailableSignals;
    private final Map<SignalType, ChangeSignal> signals;

    public DetectionResult(DetectionMethod method, ChangeMap map, ChangeMask mask, double threshold,
                           List<SignalType> fusedSignals, Map<SignalType, String> unavailableSignals,
                           Map<SignalType, ChangeSignal> signals) {
        if (map.getWidth() != mask.getWidth() || map.getHeight() != mask.getHeight()) {
            throw new IllegalArgumentException("Map " + map.getWidth() + "x" + map.getHeight()
                    + " and mask " + mask.getWidth() + "x" + mask.getHeight() + " differ in size");
        }
        this.method = method;
        this.map = map;
        this.mask = mask;
        this.threshold = threshold;
        this.changedPixels = mask.getChangedPixels();
        this.totalPixels = mask.getTotalPixels();
        this.changePercentage = mask.getChangePercentage();
        this.fusedSignals = Collections.unmodifiableList(fusedSignals);
        Map<SignalType, String> reasons = new EnumMap<>(SignalType.class);
        reasons.putAll(unavailableSignals);
        this.unavailableSignals = Collections.unmodifiableMap(reasons);
        Map<SignalType, ChangeSignal> computed = new EnumMap<>(SignalType.class);
        computed.putAll(signals);
        this.signals = Collections.unmodifiableMap(computed);
    }
}
