package com.changedetection.config;

import com.changedetection.alignment.AlignmentStrategyName;
import com.changedetection.changeSignal.ThresholdMethod;
import com.changedetection.fusion.DetectionMethod;
import com.changedetection.preprocessing.PreprocessMethod;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service level settings, bound from {@code changedetection.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "changedetection")
public class ChangeDetectionProperties {
    private Alignment alignment = new Alignment();
    private Detection detection = new Detection();
    private Cleanup cleanup = new Cleanup();
    private Preprocess preprocess = new Preprocess();

    @Getter
    @Setter
    public static class Alignment {
        private long seed = 42L;
        private AlignmentStrategyName defaultStrategy = AlignmentStrategyName.AUTO;
        private int minKeypoints = 20;
        private int eccIterations = 300;
    }

    @Getter
    @Setter
    public static class Detection {
        private DetectionMethod method = DetectionMethod.FUSION;
        private ThresholdMethod thresholdMethod = ThresholdMethod.OTSU;
        private double percentile = 95.0;
        private boolean postProcess = true;
        /** Fusion weight by signal short name (pixel, ssim, edge, texture, spectral). */
        private Map<String, Double> weights = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Cleanup {
        private int minArea = 50;
        private boolean fillHoles = false;
        private int closingRadius = 2;
        private int openingRadius = 1;
    }

    @Getter
    @Setter
    public static class Preprocess {
        private boolean enabled = false;
        private PreprocessMethod method = PreprocessMethod.AUTO;
    }
}
