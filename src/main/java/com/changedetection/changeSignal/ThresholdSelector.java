package com.changedetection.changeSignal;

import com.changedetection.imageOperator.ImageConverter;
import org.bytedeco.javacpp.IntPointer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.TermCriteria;

import java.util.Arrays;

import static org.bytedeco.opencv.global.opencv_core.CV_32S;
import static org.bytedeco.opencv.global.opencv_core.CV_8U;
import static org.bytedeco.opencv.global.opencv_core.KMEANS_USE_INITIAL_LABELS;
import static org.bytedeco.opencv.global.opencv_core.kmeans;
import static org.bytedeco.opencv.global.opencv_imgproc.THRESH_BINARY;
import static org.bytedeco.opencv.global.opencv_imgproc.THRESH_OTSU;
import static org.bytedeco.opencv.global.opencv_imgproc.threshold;

/**
 * Picks the change/no-change cut for a {@link ChangeMap}. Every policy is clamped to
 * [{@value #MIN_THRESHOLD}, {@value #MAX_THRESHOLD}] so pathological maps never yield an
 * all-changed or a forced no-change mask.
 */
public final class ThresholdSelector {
    public static final double MIN_THRESHOLD = 0.1;
    public static final double MAX_THRESHOLD = 0.9;
    public static final double DEFAULT_PERCENTILE = 95.0;

    private static final int LEVELS = 255;
    private static final int KMEANS_MAX_ITERATIONS = 100;

    private ThresholdSelector() {
    }

    public static double select(ChangeMap map, ThresholdMethod method) {
        return select(map, method, DEFAULT_PERCENTILE);
    }

    public static double select(ChangeMap map, ThresholdMethod method, double percentile) {
        double raw;
        switch (method) {
            case OTSU:
                raw = otsu(map);
                break;
            case PERCENTILE:
                raw = percentile(map, percentile);
                break;
            case KMEANS:
                raw = kMeansMidpoint(map);
                break;
            default:
                throw new IllegalArgumentException("Unknown threshold method " + method);
        }
        return clamp(raw);
    }

    public static double clamp(double threshold) {
        if (Double.isNaN(threshold)) return MIN_THRESHOLD;
        return Math.max(MIN_THRESHOLD, Math.min(MAX_THRESHOLD, threshold));
    }

    /**
     * Unclamped Otsu cut in [0,1], computed by OpenCV on the map quantised to 8 bits. The cut sits
     * between the selected level and the next one; a map with a single populated level gives 0.
     */
    static double otsu(ChangeMap map) {
        int n = map.size();
        if (n == 0) return 0.0;
        float[] values = map.values();
        float min = Float.POSITIVE_INFINITY, max = Float.NEGATIVE_INFINITY;
        for (float v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (Math.round(min * LEVELS) == Math.round(max * LEVELS)) return 0.0;

        Mat floats = ImageConverter.toMat(values, n, 1);
        Mat levels = new Mat();
        Mat binary = new Mat();
        floats.convertTo(levels, CV_8U, LEVELS, 0);
        double level = threshold(levels, binary, 0, LEVELS, THRESH_BINARY | THRESH_OTSU);
        floats.release();
        levels.release();
        binary.release();
        return (level + 0.5) / LEVELS;
    }

    static double percentile(ChangeMap map, double percentile) {
        if (!(percentile > 0 && percentile <= 100)) {
            throw new IllegalArgumentException("Percentile must be in (0,100]: " + percentile);
        }
        float[] sorted = map.values();
        if (sorted.length == 0) return 0.0;
        Arrays.sort(sorted);
        double pos = (sorted.length - 1) * percentile / 100.0;
        int lower = (int) Math.floor(pos);
        int upper = Math.min(sorted.length - 1, lower + 1);
        double frac = pos - lower;
        return sorted[lower] + frac * (sorted[upper] - sorted[lower]);
    }

    /**
     * Midpoint of the two cluster centres found by OpenCV k-means, started from a split at mid-range.
     */
    static double kMeansMidpoint(ChangeMap map) {
        int n = map.size();
        if (n == 0) return 0.0;
        float[] values = map.values();
        float low = Float.POSITIVE_INFINITY, high = Float.NEGATIVE_INFINITY;
        for (float v : values) {
            low = Math.min(low, v);
            high = Math.max(high, v);
        }
        if (high - low < 1e-12) return low;

        float cut = (low + high) / 2;
        int[] initial = new int[n];
        for (int i = 0; i < n; i++) initial[i] = values[i] > cut ? 1 : 0;

        Mat samples = ImageConverter.toMat(values, 1, n);
        Mat labels = new Mat(n, 1, CV_32S);
        new IntPointer(labels.data()).put(initial);
        Mat centers = new Mat();
        TermCriteria criteria = new TermCriteria(TermCriteria.COUNT + TermCriteria.EPS, KMEANS_MAX_ITERATIONS, 1e-9);
        kmeans(samples, 2, labels, criteria, 1, KMEANS_USE_INITIAL_LABELS, centers);
        float[] centres = ImageConverter.toArray(centers);
        samples.release();
        labels.release();
        centers.release();
        criteria.close();
        return (centres[0] + centres[1]) / 2.0;
    }
}
