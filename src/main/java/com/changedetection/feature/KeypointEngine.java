package com.changedetection.feature;

import com.changedetection.exception.InsufficientFeaturesException;
import com.changedetection.imageOperator.Image;
import com.changedetection.imageOperator.ImageConverter;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.opencv.opencv_core.KeyPoint;
import org.bytedeco.opencv.opencv_core.KeyPointVector;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_features2d.Feature2D;
import org.bytedeco.opencv.opencv_features2d.GFTTDetector;
import org.bytedeco.opencv.opencv_features2d.ORB;
import org.bytedeco.opencv.opencv_features2d.SIFT;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;

/**
 * Detects and describes interest points on the grayscale version of an image.
 * Stateless: detectors are created per call from the given parameters.
 */
@Slf4j
public class KeypointEngine {

    public List<Keypoint> detect(Image image, FeatureMethod method, KeypointParameters params)
            throws InsufficientFeaturesException {
        Mat gray = ImageConverter.toGray8U(image);
        KeyPointVector found = new KeyPointVector();
        Feature2D detector = createDetector(method, params);
        try {
            detector.detect(gray, found);
        } finally {
            gray.release();
            detector.close();
        }

        List<Keypoint> keypoints = toKeypoints(found, method, params);
        keypoints.sort(Comparator.comparingDouble(Keypoint::getStrength).reversed());
        if (keypoints.size() > params.getMaxKeypoints()) {
            keypoints = new ArrayList<>(keypoints.subList(0, params.getMaxKeypoints()));
        }
        log.debug("{} detected {} keypoints on {}", method, keypoints.size(), image.describeShape());

        if (keypoints.size() < params.getMinKeypoints()) {
            throw new InsufficientFeaturesException(method + " detection", keypoints.size(), params.getMinKeypoints());
        }
        return keypoints;
    }

    /**
     * Computes descriptors for the given keypoints. Keypoints the extractor cannot describe
     * (too close to the border) are dropped, so the result stays paired 1:1.
     */
    public FeatureSet describe(Image image, List<Keypoint> keypoints, FeatureMethod method, KeypointParameters params)
            throws InsufficientFeaturesException {
        KeyPointVector input = new KeyPointVector();
        for (Keypoint kp : keypoints) {
            input.push_back(new KeyPoint((float) kp.getX(), (float) kp.getY(), (float) kp.getScale(),
                    (float) kp.getOrientation(), (float) kp.getStrength(), kp.getOctave(), -1));
        }

        Mat gray = ImageConverter.toGray8U(image);
        Mat descriptors = new Mat();
        Feature2D extractor = createExtractor(method, params);
        try {
            extractor.compute(gray, input, descriptors);
        } finally {
            gray.release();
            extractor.close();
        }

        List<Keypoint> kept = new ArrayList<>();
        for (long i = 0; i < input.size(); i++) {
            kept.add(fromOpenCv(input.get(i)));
        }
        List<Descriptor> described = toDescriptors(descriptors, method);
        descriptors.release();

        if (kept.size() != described.size()) {
            throw new IllegalStateException(method + " returned " + described.size()
                    + " descriptors for " + kept.size() + " keypoints");
        }
        if (kept.size() < params.getMinKeypoints()) {
            throw new InsufficientFeaturesException(method + " description", kept.size(), params.getMinKeypoints());
        }
        return new FeatureSet(method, kept, described);
    }

    public FeatureSet detectAndDescribe(Image image, FeatureMethod method, KeypointParameters params)
            throws InsufficientFeaturesException {
        return describe(image, detect(image, method, params), method, params);
    }

    private Feature2D createDetector(FeatureMethod method, KeypointParameters params) {
        switch (method) {
            case SIFT:
                return createSift(params);
            case ORB:
                return ORB.create(params.getMaxKeypoints(), (float) params.getOrbScaleFactor(), params.getOrbLevels(),
                        31, 0, 2, ORB.HARRIS_SCORE, 31, params.getOrbFastThreshold());
            case HARRIS:
                return GFTTDetector.create(params.getMaxKeypoints(), params.getHarrisQualityLevel(),
                        params.getHarrisMinDistance(), params.getHarrisBlockSize(), true, params.getHarrisK());
            default:
                throw new IllegalArgumentException("Unknown feature method " + method);
        }
    }

    private Feature2D createExtractor(FeatureMethod method, KeypointParameters params) {
        // Harris corners have no descriptor of their own
        if (method == FeatureMethod.HARRIS) return createSift(params);
        return createDetector(method, params);
    }

    private SIFT createSift(KeypointParameters params) {
        return SIFT.create(0, params.getSiftOctaveLayers(), params.getSiftContrastThreshold(),
                params.getSiftEdgeThreshold(), params.getSiftSigma(), false);
    }

    private List<Keypoint> toKeypoints(KeyPointVector found, FeatureMethod method, KeypointParameters params) {
        List<Keypoint> keypoints = new ArrayList<>((int) found.size());
        for (long i = 0; i < found.size(); i++) {
            KeyPoint kp = found.get(i);
            if (method == FeatureMethod.HARRIS) {
                // fixed support region and upright orientation for corner descriptors
                keypoints.add(new Keypoint(kp.pt().x(), kp.pt().y(), params.getHarrisDescriptorSize(), 0.0,
                        kp.response(), 0));
            } else {
                keypoints.add(fromOpenCv(kp));
            }
        }
        return keypoints;
    }

    private static Keypoint fromOpenCv(KeyPoint kp) {
        return new Keypoint(kp.pt().x(), kp.pt().y(), kp.size(), kp.angle(), kp.response(), kp.octave());
    }

    private static List<Descriptor> toDescriptors(Mat descriptors, FeatureMethod method) {
        List<Descriptor> out = new ArrayList<>();
        if (descriptors.empty()) return out;
        int rows = descriptors.rows(), cols = descriptors.cols();
        if (method.isBinaryDescriptor()) {
            byte[] buf = new byte[rows * cols];
            descriptors.data().get(buf);
            for (int r = 0; r < rows; r++) {
                byte[] row = new byte[cols];
                System.arraycopy(buf, r * cols, row, 0, cols);
                out.add(Descriptor.ofBits(row));
            }
        } else {
            Mat floats = descriptors;
            if (descriptors.type() != CV_32F) {
                floats = new Mat();
                descriptors.convertTo(floats, CV_32F);
            }
            float[] buf = new float[rows * cols];
            new FloatPointer(floats.data()).get(buf);
            for (int r = 0; r < rows; r++) {
                float[] row = new float[cols];
                System.arraycopy(buf, r * cols, row, 0, cols);
                out.add(Descriptor.ofValues(row));
            }
        }
        return out;
    }
}
