package com.changedetection.feature;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Detected interest point. Scale is the diameter of the support region in pixels,
 * orientation is in degrees as reported by the detector.
 */
@AllArgsConstructor
@Getter
public final class Keypoint {
    private final double x, y;
    private final double scale;
    private final double orientation;
    private final double strength;
    private final int octave; // packed detector octave, needed to re-describe blob keypoints

    @Override
    public String toString() {
        return String.format("Keypoint(%.2f, %.2f) scale=%.2f angle=%.1f strength=%.4f",
                x, y, scale, orientation, strength);
    }
}
