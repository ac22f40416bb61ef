package com.changedetection.matchAndTransform;

import lombok.Getter;

/**
 * Outcome of robust estimation: the refit transform and which correspondences support it.
 */
@Getter
public final class TransformEstimate {
    private final Transform transform;
    @Getter(lombok.AccessLevel.NONE)
    private final boolean[] inlierMask;
    private final int inlierCount;
    private final int trials;
    private final double rmsResidual;

    public TransformEstimate(Transform transform, boolean[] inlierMask, int trials, double rmsResidual) {
        this.transform = transform;
        this.inlierMask = inlierMask.clone();
        int count = 0;
        for (boolean b : inlierMask) if (b) count++;
        this.inlierCount = count;
        this.trials = trials;
        this.rmsResidual = rmsResidual;
    }

    public boolean[] getInlierMask() {
        return inlierMask.clone();
    }

    public boolean isInlier(int index) {
        return inlierMask[index];
    }

    public int getCorrespondenceCount() {
        return inlierMask.length;
    }

    public double getInlierRatio() {
        return inlierMask.length == 0 ? 0.0 : (double) inlierCount / inlierMask.length;
    }
}
