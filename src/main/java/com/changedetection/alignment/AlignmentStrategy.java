package com.changedetection.alignment;

import com.changedetection.exception.AlignmentException;
import com.changedetection.imageOperator.Image;

/**
 * One way of estimating the transform that maps the moving image onto the fixed one.
 */
public interface AlignmentStrategy {

    AlignmentStrategyName getName();

    AlignmentEstimate estimate(Image fixed, Image moving) throws AlignmentException;
}
