package com.changedetection.exception;

import lombok.Getter;

/**
 * The estimated transform is singular, non-finite, or scales the scene too far from rigid.
 */
@Getter
public class DegenerateModelException extends AlignmentException {
    private final double determinant;

    public DegenerateModelException(String stage, int inliers, double determinant, String reason) {
        super(stage, inliers, 0, String.format("%s: degenerate transform (det=%.4f, inliers=%d): %s",
                stage, determinant, inliers, reason));
        this.determinant = determinant;
    }

    public DegenerateModelException(String stage, String reason, Throwable cause) {
        super(stage, stage + ": " + reason, cause);
        this.determinant = Double.NaN;
    }
}
