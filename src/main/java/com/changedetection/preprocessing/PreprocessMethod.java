package com.changedetection.preprocessing;

public enum PreprocessMethod {
    /** Picks the steps from the band count and a noise estimate. */
    AUTO,
    /** Per-band percentile contrast stretch. */
    ENHANCE,
    /** Per-band median filter. */
    DENOISE,
    /** Per-band min-max scaling to the 8-bit range. */
    NORMALIZE,
    /** Three-band composite of a multispectral image. */
    MULTISPECTRAL;

    public static PreprocessMethod parse(String value) {
        if (value == null || value.isBlank()) return AUTO;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown preprocessing method '" + value + "'", e);
        }
    }
}
