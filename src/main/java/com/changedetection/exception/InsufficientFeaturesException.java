package com.changedetection.exception;

public class InsufficientFeaturesException extends AlignmentException {

    public InsufficientFeaturesException(String stage, int observed, int required) {
        super(stage, observed, required,
                String.format("%s: only %d keypoints detected (need %d)", stage, observed, required));
    }
}
