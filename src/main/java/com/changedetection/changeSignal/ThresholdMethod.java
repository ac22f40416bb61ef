package com.changedetection.changeSignal;

public enum ThresholdMethod {
    /** Histogram between-class variance maximisation. */
    OTSU,
    /** Fixed percentile of the map's value distribution. */
    PERCENTILE,
    /** 2-means clustering, threshold at the midpoint of the two centres. */
    KMEANS;

    public static ThresholdMethod parse(String value) {
        if (value == null || value.isBlank()) return OTSU;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown threshold method '" + value + "'", e);
        }
    }
}
