package com.changedetection.exception;

import lombok.Getter;

@Getter
public class DimensionMismatchException extends ChangeDetectionException {
    private final String expected;
    private final String actual;

    public DimensionMismatchException(String expected, String actual) {
        super("Images must have identical dimensions for change detection (expected " + expected
                + ", got " + actual + "); align them first");
        this.expected = expected;
        this.actual = actual;
    }
}
