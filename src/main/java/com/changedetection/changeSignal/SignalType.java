package com.changedetection.changeSignal;

/**
 * The independent change estimators, with their default fusion weights.
 */
public enum SignalType {
    PIXEL_DIFFERENCE("pixel", 1.0),
    STRUCTURAL_SIMILARITY("ssim", 1.0),
    EDGE_CHANGE("edge", 0.5),
    TEXTURE_CHANGE("texture", 0.5),
    SPECTRAL_ANGLE("spectral", 1.0);

    private final String shortName;
    private final double defaultWeight;

    SignalType(String shortName, double defaultWeight) {
        this.shortName = shortName;
        this.defaultWeight = defaultWeight;
    }

    public String getShortName() {
        return shortName;
    }

    public double getDefaultWeight() {
        return defaultWeight;
    }
}
