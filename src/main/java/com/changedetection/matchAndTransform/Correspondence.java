package com.changedetection.matchAndTransform;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Claimed match between keypoint {@code indexA} of the fixed image and keypoint {@code indexB}
 * of the moving image. Lower distance means a better descriptor match.
 */
@AllArgsConstructor
@Getter
public final class Correspondence {
    private final int indexA;
    private final int indexB;
    private final double xA, yA;
    private final double xB, yB;
    private final double distance;

    /**
     * Correspondence without descriptor information, for point sets built directly.
     */
    public static Correspondence ofPoints(int index, double xA, double yA, double xB, double yB) {
        return new Correspondence(index, index, xA, yA, xB, yB, 0.0);
    }
}
