package com.changedetection.exception;

import lombok.Getter;

@Getter
public class UnsupportedBandCountException extends ChangeDetectionException {
    private final int bands;

    public UnsupportedBandCountException(String stage, int bands, String requirement) {
        super(stage + ": unsupported band count " + bands + " (" + requirement + ")");
        this.bands = bands;
    }
}
