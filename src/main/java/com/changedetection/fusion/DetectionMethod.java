package com.changedetection.fusion;

import com.changedetection.changeSignal.SignalType;

public enum DetectionMethod {
    /** Weighted fusion of every available signal. */
    FUSION(null),
    PIXEL(SignalType.PIXEL_DIFFERENCE),
    SSIM(SignalType.STRUCTURAL_SIMILARITY),
    EDGE(SignalType.EDGE_CHANGE),
    TEXTURE(SignalType.TEXTURE_CHANGE),
    /** Falls back to pixel difference on single band input. */
    SPECTRAL(SignalType.SPECTRAL_ANGLE);

    private final SignalType signalType;

    DetectionMethod(SignalType signalType) {
        this.signalType = signalType;
    }

    public SignalType getSignalType() {
        return signalType;
    }

    public static DetectionMethod parse(String value) {
        if (value == null || value.isBlank()) return FUSION;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown detection method '" + value + "'", e);
        }
    }
}
