package com.changedetection.alignment;

import com.changedetection.feature.FeatureMethod;

public enum AlignmentStrategyName {
    /** Walks the whole fallback chain. */
    AUTO(null),
    SIFT(FeatureMethod.SIFT),
    ORB(FeatureMethod.ORB),
    HARRIS(FeatureMethod.HARRIS),
    /** Direct intensity registration without keypoints. */
    INTENSITY(null);

    private final FeatureMethod featureMethod;

    AlignmentStrategyName(FeatureMethod featureMethod) {
        this.featureMethod = featureMethod;
    }

    public FeatureMethod getFeatureMethod() {
        return featureMethod;
    }

    public static AlignmentStrategyName parse(String value) {
        if (value == null || value.isBlank()) return AUTO;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown alignment strategy '" + value + "'", e);
        }
    }
}
