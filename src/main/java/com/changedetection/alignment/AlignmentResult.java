package com.changedetection.alignment;

import com.changedetection.imageOperator.Image;
import com.changedetection.matchAndTransform.Transform;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * Result of one alignment call. The aligned image always has the fixed image's size.
 */
@Builder
@Getter
public class AlignmentResult {
    private final Transform transform;
    private final Image alignedImage;
    private final String method;
    private final boolean success;
    private final int keypointsFixed;
    private final int keypointsMoving;
    private final int matches;
    private final int inliers;
    private final double rmsResidual;
    private final double score;
    @Singular
    private final List<AlignmentAttempt> attempts;

    public double getInlierRatio() {
        return matches == 0 ? 0.0 : (double) inliers / matches;
    }
}
