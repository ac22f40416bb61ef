package com.changedetection.changeSignal;

import com.changedetection.imageOperator.Image;
import com.changedetection.imageOperator.SeparableFilter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Absolute grayscale difference, optionally Gaussian smoothed.
 */
public class PixelDifferenceSignal implements ChangeSignalDetector {

    @Override
    public SignalType getType() {
        return SignalType.PIXEL_DIFFERENCE;
    }

    @Override
    public ChangeSignal compute(Image before, Image after, SignalParameters params) {
        Images.requireSameShape(before, after);
        int w = before.getWidth(), h = before.getHeight();
        float[] g1 = before.toGray();
        float[] g2 = after.toGray();

        double[] diff = new double[g1.length];
        for (int i = 0; i < diff.length; i++) diff[i] = Math.abs((double) g2[i] - g1[i]);

        Map<String, Double> stats = new LinkedHashMap<>();
        stats.put("meanDifference", Images.mean(diff));
        stats.put("stdDifference", Images.std(diff));

        if (params.getDifferenceSigma() > 0) {
            diff = SeparableFilter.gaussian(diff, w, h, params.getDifferenceSigma());
        }
        return new ChangeSignal(getType(), ChangeMap.normalize(w, h, diff), stats);
    }
}
