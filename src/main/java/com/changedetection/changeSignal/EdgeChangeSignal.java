package com.changedetection.changeSignal;

import com.changedetection.imageOperator.Image;
import com.changedetection.imageOperator.ImageConverter;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Edges that appear in only one of the two images, dilated into regions.
 */
public class EdgeChangeSignal implements ChangeSignalDetector {

    @Override
    public SignalType getType() {
        return SignalType.EDGE_CHANGE;
    }

    @Override
    public ChangeSignal compute(Image before, Image after, SignalParameters params) {
        Images.requireSameShape(before, after);
        int w = before.getWidth(), h = before.getHeight();
        boolean[] edges1 = edges(before, params);
        boolean[] edges2 = edges(after, params);

        long added = 0, removed = 0;
        boolean[] changed = new boolean[edges1.length];
        for (int i = 0; i < changed.length; i++) {
            if (edges2[i] && !edges1[i]) added++;
            if (edges1[i] && !edges2[i]) removed++;
            changed[i] = edges1[i] != edges2[i];
        }

        boolean[] regions = dilateRegions(ChangeMask.of(w, h, changed), params.getEdgeDilationRadius());
        double[] raw = new double[regions.length];
        for (int i = 0; i < raw.length; i++) raw[i] = regions[i] ? 1.0 : 0.0;

        Map<String, Double> stats = new LinkedHashMap<>();
        stats.put("edgesAdded", (double) added);
        stats.put("edgesRemoved", (double) removed);
        return new ChangeSignal(getType(), ChangeMap.normalize(w, h, raw), stats);
    }

    private static boolean[] edges(Image image, SignalParameters params) {
        Mat gray = ImageConverter.toGray8U(image);
        Mat edges = new Mat();
        Canny(gray, edges, params.getCannyLow(), params.getCannyHigh());
        boolean[] out = ImageConverter.toBooleans(edges);
        gray.release();
        edges.release();
        return out;
    }

    private static boolean[] dilateRegions(ChangeMask mask, int radius) {
        if (radius <= 0) return mask.values();
        Mat src = ImageConverter.toMat(mask);
        Mat dst = new Mat();
        Mat kernel = getStructuringElement(MORPH_ELLIPSE, new Size(2 * radius + 1, 2 * radius + 1));
        dilate(src, dst, kernel);
        boolean[] out = ImageConverter.toBooleans(dst);
        src.release();
        dst.release();
        kernel.release();
        return out;
    }
}
