package com.changedetection.changeSignal;

import com.changedetection.imageOperator.Image;
import com.changedetection.imageOperator.SeparableFilter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Difference of local standard deviation, a cheap texture measure.
 */
public class TextureChangeSignal implements ChangeSignalDetector {

    @Override
    public SignalType getType() {
        return SignalType.TEXTURE_CHANGE;
    }

    @Override
    public ChangeSignal compute(Image before, Image after, SignalParameters params) {
        Images.requireSameShape(before, after);
        int w = before.getWidth(), h = before.getHeight();
        int window = params.getTextureWindow();
        double[] t1 = localStd(SeparableFilter.toDouble(before.toGray()), w, h, window);
        double[] t2 = localStd(SeparableFilter.toDouble(after.toGray()), w, h, window);

        double[] diff = new double[t1.length];
        for (int i = 0; i < diff.length; i++) diff[i] = Math.abs(t2[i] - t1[i]);

        Map<String, Double> stats = new LinkedHashMap<>();
        stats.put("meanTextureChange", Images.mean(diff));
        return new ChangeSignal(getType(), ChangeMap.normalize(w, h, diff), stats);
    }

    /**
     * Sample standard deviation over a window x window neighbourhood.
     */
    static double[] localStd(double[] gray, int width, int height, int window) {
        double[] squares = new double[gray.length];
        for (int i = 0; i < gray.length; i++) squares[i] = gray[i] * gray[i];
        double[] mean = SeparableFilter.boxMean(gray, width, height, window);
        double[] meanSq = SeparableFilter.boxMean(squares, width, height, window);
        double n = (double) window * window;
        double correction = n > 1 ? n / (n - 1) : 1.0;
        double[] std = new double[gray.length];
        for (int i = 0; i < std.length; i++) {
            std[i] = Math.sqrt(Math.max(0.0, (meanSq[i] - mean[i] * mean[i]) * correction));
        }
        return std;
    }
}
