package com.changedetection.alignment;

import com.changedetection.matchAndTransform.Transform;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Transform produced by a strategy, with the counts that back it.
 */
@AllArgsConstructor
@Getter
public class AlignmentEstimate {
    private final Transform transform;
    private final int keypointsFixed;
    private final int keypointsMoving;
    private final int matches;
    private final int inliers;
    private final double rmsResidual;
    // inlier ratio for feature methods, correlation coefficient for intensity registration
    private final double score;
}
