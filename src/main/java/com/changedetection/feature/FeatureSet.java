package com.changedetection.feature;

import lombok.Getter;
import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.Collections;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_core.CV_8U;

/**
 * Keypoints of one image paired 1:1 with their descriptors.
 */
@Getter
public final class FeatureSet {
    private final FeatureMethod method;
    private final List<Keypoint> keypoints;
    private final List<Descriptor> descriptors;

    public FeatureSet(FeatureMethod method, List<Keypoint> keypoints, List<Descriptor> descriptors) {
        if (keypoints.size() != descriptors.size()) {
            throw new IllegalArgumentException("Got " + keypoints.size() + " keypoints but "
                    + descriptors.size() + " descriptors");
        }
        this.method = method;
        this.keypoints = Collections.unmodifiableList(keypoints);
        this.descriptors = Collections.unmodifiableList(descriptors);
    }

    public int size() {
        return keypoints.size();
    }

    public boolean isEmpty() {
        return keypoints.isEmpty();
    }

    /**
     * Packs the descriptors into one matrix, a row per keypoint, for the OpenCV matcher.
     */
    public Mat toDescriptorMat() {
        if (descriptors.isEmpty()) return new Mat();
        int rows = descriptors.size();
        int cols = descriptors.get(0).length();
        if (method.isBinaryDescriptor()) {
            Mat mat = new Mat(rows, cols, CV_8U);
            byte[] buf = new byte[rows * cols];
            for (int i = 0; i < rows; i++) System.arraycopy(descriptors.get(i).bitsView(), 0, buf, i * cols, cols);
            mat.data().put(buf);
            return mat;
        }
        Mat mat = new Mat(rows, cols, CV_32F);
        float[] buf = new float[rows * cols];
        for (int i = 0; i < rows; i++) System.arraycopy(descriptors.get(i).valuesView(), 0, buf, i * cols, cols);
        new FloatPointer(mat.data()).put(buf);
        return mat;
    }
}
