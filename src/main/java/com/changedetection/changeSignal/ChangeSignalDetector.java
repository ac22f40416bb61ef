package com.changedetection.changeSignal;

import com.changedetection.imageOperator.Image;

/**
 * A change estimator over an aligned image pair of identical dimensions.
 */
public interface ChangeSignalDetector {

    SignalType getType();

    /**
     * @throws com.changedetection.exception.DimensionMismatchException if the images differ in shape
     * @throws com.changedetection.exception.UnsupportedBandCountException if the detector cannot use the bands
     */
    ChangeSignal compute(Image before, Image after, SignalParameters params);
}
