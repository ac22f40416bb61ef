package com.changedetection.matchAndTransform;

/**
 * Geometric models the robust estimator can fit.
 */
public enum ModelFamily {
    /** Rotation, uniform scale and translation: 4 degrees of freedom. */
    SIMILARITY(2),
    /** Rotation, non-uniform scale, shear and translation: 6 degrees of freedom. */
    AFFINE(3);

    private final int minimalSampleSize;

    ModelFamily(int minimalSampleSize) {
        this.minimalSampleSize = minimalSampleSize;
    }

    public int getMinimalSampleSize() {
        return minimalSampleSize;
    }
}
