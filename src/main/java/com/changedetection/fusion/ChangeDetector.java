package com.changedetection.fusion;

import com.changedetection.changeSignal.ChangeMap;
import com.changedetection.changeSignal.ChangeMask;
import com.changedetection.changeSignal.ChangeSignal;
import com.changedetection.changeSignal.ChangeSignalLibrary;
import com.changedetection.changeSignal.SignalOutcome;
import com.changedetection.changeSignal.SignalType;
import com.changedetection.changeSignal.ThresholdSelector;
import com.changedetection.exception.ChangeDetectionException;
import com.changedetection.exception.DimensionMismatchException;
import com.changedetection.imageOperator.Image;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an aligned image pair into a change map and a cleaned change mask.
 */
@Slf4j
public class ChangeDetector {
    private final ChangeSignalLibrary library;
    private final FusionEngine fusionEngine;
    private final MaskCleanup cleanup;

    public ChangeDetector() {
        this(new ChangeSignalLibrary(), new FusionEngine(), new MaskCleanup());
    }

    public ChangeDetector(ChangeSignalLibrary library, FusionEngine fusionEngine, MaskCleanup cleanup) {
        this.library = library;
        this.fusionEngine = fusionEngine;
        this.cleanup = cleanup;
    }

    public DetectionResult detect(Image before, Image after) {
        return detect(before, after, DetectionMethod.FUSION, new DetectionParameters());
    }

    /**
     * @throws DimensionMismatchException when the pair is not the same size and band count
     */
    public DetectionResult detect(Image before, Image after, DetectionMethod method, DetectionParameters params) {
        if (!before.hasSameShape(after)) {
            throw new DimensionMismatchException(before.describeShape(), after.describeShape());
        }

        ChangeMap map;
        List<SignalType> fused;
        Map<SignalType, String> unavailable = new EnumMap<>(SignalType.class);
        Map<SignalType, ChangeSignal> signals = new EnumMap<>(SignalType.class);

        if (method == DetectionMethod.FUSION) {
            Map<SignalType, SignalOutcome> outcomes = library.computeAll(before, after, params.getSignals());
            for (SignalOutcome outcome : outcomes.values()) {
                if (outcome.isAvailable()) signals.put(outcome.getType(), outcome.getSignal());
            }
            FusionResult fusion = fusionEngine.fuse(outcomes, params.getWeights(), params.isRenormalizeFusion());
            map = fusion.getMap();
            fused = fusion.getFusedSignals();
            unavailable.putAll(fusion.getUnavailableSignals());
        } else {
            SignalType type = method.getSignalType();
            if (type == SignalType.SPECTRAL_ANGLE && before.getBandCount() < 3) {
                log.info("Spectral angle needs multi-band input, using pixel difference on {}", before.describeShape());
                unavailable.put(type, "single band input");
                type = SignalType.PIXEL_DIFFERENCE;
            }
            SignalOutcome outcome = library.compute(before, after, params.getSignals(),
                    Collections.singleton(type)).get(type);
            if (!outcome.isAvailable()) {
                throw new ChangeDetectionException(type + " could not be computed: " + outcome.getReason());
            }
            signals.put(type, outcome.getSignal());
            map = outcome.getSignal().getMap();
            fused = new ArrayList<>(Collections.singletonList(type));
        }

        double threshold = params.getThreshold() != null
                ? ThresholdSelector.clamp(params.getThreshold())
                : ThresholdSelector.select(map, params.getThresholdMethod(), params.getPercentile());
        ChangeMask mask = map.threshold(threshold);
        if (params.isPostProcess()) {
            mask = cleanup.clean(mask, params.getCleanup());
        }

        DetectionResult result = new DetectionResult(method, map, mask, threshold, fused, unavailable, signals);
        log.info("{} detection on {}: threshold {}, {} of {} pixels changed ({}%), signals {}", method,
                before.describeShape(), String.format("%.3f", threshold), result.getChangedPixels(),
                result.getTotalPixels(), String.format("%.2f", result.getChangePercentage()), fused);
        return result;
    }
}
