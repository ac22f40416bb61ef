package com.changedetection.changeSignal;

import com.changedetection.exception.DimensionMismatchException;
import com.changedetection.exception.UnsupportedBandCountException;
import com.changedetection.imageOperator.Image;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Registry of the change detectors. A detector that cannot run on the given pair yields an
 * unavailable {@link SignalOutcome}; only a dimension mismatch between the inputs is fatal.
 */
@Slf4j
public class ChangeSignalLibrary {
    private final Map<SignalType, ChangeSignalDetector> detectors = new EnumMap<>(SignalType.class);

    public ChangeSignalLibrary() {
        this(Arrays.asList(
                new PixelDifferenceSignal(),
                new StructuralSimilaritySignal(),
                new EdgeChangeSignal(),
                new TextureChangeSignal(),
                new SpectralAngleSignal()));
    }

    public ChangeSignalLibrary(List<? extends ChangeSignalDetector> detectors) {
        for (ChangeSignalDetector detector : detectors) {
            if (this.detectors.put(detector.getType(), detector) != null) {
                throw new IllegalArgumentException("Duplicate detector for " + detector.getType());
            }
        }
    }

    public ChangeSignalDetector get(SignalType type) {
        ChangeSignalDetector detector = detectors.get(type);
        if (detector == null) throw new IllegalArgumentException("No detector registered for " + type);
        return detector;
    }

    public Map<SignalType, SignalOutcome> computeAll(Image before, Image after, SignalParameters params) {
        return compute(before, after, params, EnumSet.allOf(SignalType.class));
    }

    /**
     * Runs the requested detectors. Every requested type gets an outcome, available or not.
     *
     * @throws DimensionMismatchException when the pair differs in width, height or band count
     */
    public Map<SignalType, SignalOutcome> compute(Image before, Image after, SignalParameters params,
                                                  Collection<SignalType> types) {
        Images.requireSameShape(before, after);
        Map<SignalType, SignalOutcome> outcomes = new EnumMap<>(SignalType.class);
        Collection<SignalType> ordered = types.isEmpty() ? EnumSet.noneOf(SignalType.class) : EnumSet.copyOf(types);
        for (SignalType type : ordered) {
            ChangeSignalDetector detector = detectors.get(type);
            if (detector == null) {
                outcomes.put(type, SignalOutcome.unavailable(type, "no detector registered"));
                continue;
            }
            try {
                ChangeSignal signal = detector.compute(before, after, params);
                log.debug("{} signal: mean {} standalone threshold {}", type, signal.getMap().mean(),
                        signal.getStandaloneThreshold());
                outcomes.put(type, SignalOutcome.available(signal));
            } catch (DimensionMismatchException e) {
                throw e;
            } catch (UnsupportedBandCountException e) {
                log.info("{} signal unavailable: {}", type, e.getMessage());
                outcomes.put(type, SignalOutcome.unavailable(type, e.getMessage()));
            } catch (RuntimeException e) {
                // native OpenCV errors surface as RuntimeException
                log.warn("{} signal failed", type, e);
                outcomes.put(type, SignalOutcome.unavailable(type, e.toString()));
            }
        }
        return outcomes;
    }
}
