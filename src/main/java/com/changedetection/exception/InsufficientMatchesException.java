package com.changedetection.exception;

public class InsufficientMatchesException extends AlignmentException {

    public InsufficientMatchesException(String stage, int observed, int required) {
        super(stage, observed, required,
                String.format("%s: only %d matches survived the ratio test (need %d)", stage, observed, required));
    }
}
