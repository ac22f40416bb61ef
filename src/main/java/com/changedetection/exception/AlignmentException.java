package com.changedetection.exception;

import lombok.Getter;

/**
 * Failure of one alignment stage. Carries the stage name and the counts observed when it gave up,
 * so the pipeline can report why a method was skipped.
 */
@Getter
public abstract class AlignmentException extends Exception {
    private final String stage;
    private final int observed;
    private final int required;

    protected AlignmentException(String stage, int observed, int required, String message) {
        super(message);
        this.stage = stage;
        this.observed = observed;
        this.required = required;
    }

    protected AlignmentException(String stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.observed = 0;
        this.required = 0;
    }
}
