package com.changedetection.changeSignal;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of one detector: the normalised map, a standalone Otsu mask for diagnostics,
 * and detector specific statistics.
 */
@Getter
public final class ChangeSignal {
    private final SignalType type;
    private final ChangeMap map;
    private final double standaloneThreshold;
    private final ChangeMask standaloneMask;
    private final Map<String, Double> statistics;

    public ChangeSignal(SignalType type, ChangeMap map, Map<String, Double> statistics) {
        this.type = type;
        this.map = map;
        this.standaloneThreshold = ThresholdSelector.select(map, ThresholdMethod.OTSU);
        this.standaloneMask = map.threshold(standaloneThreshold);
        this.statistics = Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
    }

    public double getStatistic(String name) {
        Double value = statistics.get(name);
        if (value == null) throw new IllegalArgumentException(type + " has no statistic '" + name + "'");
        return value;
    }
}
