package com.changedetection.feature;

import lombok.Getter;
import lombok.Setter;

/**
 * Detector tuning. Defaults follow the field-tested values of the desktop tool.
 */
@Getter
@Setter
public class KeypointParameters {
    // Floor below which matching is not attempted
    private int minKeypoints = 20;
    private int maxKeypoints = 4000;

    // SIFT
    private int siftOctaveLayers = 3;
    private double siftContrastThreshold = 0.04;
    private double siftEdgeThreshold = 10.0;
    private double siftSigma = 1.6;

    // ORB
    private double orbScaleFactor = 1.2;
    private int orbLevels = 8;
    private int orbFastThreshold = 20;

    // Harris
    private double harrisQualityLevel = 0.001;
    private int harrisBlockSize = 5;
    private double harrisMinDistance = 3.0;
    private double harrisK = 0.04;
    private float harrisDescriptorSize = 16f;
}
