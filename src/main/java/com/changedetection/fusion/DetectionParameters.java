package com.changedetection.fusion;

import com.changedetection.changeSignal.SignalParameters;
import com.changedetection.changeSignal.ThresholdMethod;
import com.changedetection.changeSignal.ThresholdSelector;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class DetectionParameters {
    private ThresholdMethod thresholdMethod = ThresholdMethod.OTSU;
    private double percentile = ThresholdSelector.DEFAULT_PERCENTILE;
    /** Manual threshold; when set it replaces the adaptive policy but is still clamped. */
    private Double threshold;
    private boolean postProcess = true;
    private boolean renormalizeFusion = true;
    private SignalParameters signals = new SignalParameters();
    private FusionWeights weights = FusionWeights.defaults();
    private CleanupParameters cleanup = new CleanupParameters();
}
