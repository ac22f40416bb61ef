package com.changedetection.feature;

import static org.bytedeco.opencv.global.opencv_core.NORM_HAMMING;
import static org.bytedeco.opencv.global.opencv_core.NORM_L2;

/**
 * Interest point families available to the alignment pipeline.
 */
public enum FeatureMethod {
    /** Difference-of-Gaussians blobs with gradient histogram descriptors. */
    SIFT(false, NORM_L2),
    /** FAST corners with rotated BRIEF binary descriptors. */
    ORB(true, NORM_HAMMING),
    /** Harris corner response, described with gradient histograms at a fixed support size. */
    HARRIS(false, NORM_L2);

    private final boolean binaryDescriptor;
    private final int normType;

    FeatureMethod(boolean binaryDescriptor, int normType) {
        this.binaryDescriptor = binaryDescriptor;
        this.normType = normType;
    }

    public boolean isBinaryDescriptor() {
        return binaryDescriptor;
    }

    public int getNormType() {
        return normType;
    }
}
