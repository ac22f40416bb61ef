package com.changedetection.exception;

/**
 * Base class for misuse of the change detection contract.
 */
public class ChangeDetectionException extends RuntimeException {

    public ChangeDetectionException(String message) {
        super(message);
    }
}
