package com.changedetection.exception;

import lombok.Getter;

@Getter
public class InsufficientTrialsException extends AlignmentException {
    private final int trials;

    public InsufficientTrialsException(String stage, int bestInliers, int requiredInliers, int trials) {
        super(stage, bestInliers, requiredInliers, String.format(
                "%s: best of %d trials reached %d inliers (need %d)", stage, trials, bestInliers, requiredInliers));
        this.trials = trials;
    }
}
