package com.changedetection.changeSignal;

import com.changedetection.imageOperator.Image;
import com.changedetection.imageOperator.SeparableFilter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dissimilarity {@code 1 - SSIM} over a Gaussian window, so that higher means more changed.
 */
public class StructuralSimilaritySignal implements ChangeSignalDetector {

    @Override
    public SignalType getType() {
        return SignalType.STRUCTURAL_SIMILARITY;
    }

    @Override
    public ChangeSignal compute(Image before, Image after, SignalParameters params) {
        Images.requireSameShape(before, after);
        int w = before.getWidth(), h = before.getHeight();
        double[] x = SeparableFilter.toDouble(before.toGray());
        double[] y = SeparableFilter.toDouble(after.toGray());
        int n = x.length;

        double[] xx = new double[n], yy = new double[n], xy = new double[n];
        for (int i = 0; i < n; i++) {
            xx[i] = x[i] * x[i];
            yy[i] = y[i] * y[i];
            xy[i] = x[i] * y[i];
        }
        int window = params.getSsimWindow();
        double sigma = params.getSsimSigma();
        double[] muX = SeparableFilter.gaussian(x, w, h, window, sigma);
        double[] muY = SeparableFilter.gaussian(y, w, h, window, sigma);
        double[] eXX = SeparableFilter.gaussian(xx, w, h, window, sigma);
        double[] eYY = SeparableFilter.gaussian(yy, w, h, window, sigma);
        double[] eXY = SeparableFilter.gaussian(xy, w, h, window, sigma);

        double range = before.getMaxValue();
        double c1 = Math.pow(params.getSsimK1() * range, 2);
        double c2 = Math.pow(params.getSsimK2() * range, 2);

        double[] dissimilarity = new double[n];
        double ssimSum = 0;
        for (int i = 0; i < n; i++) {
            double varX = eXX[i] - muX[i] * muX[i];
            double varY = eYY[i] - muY[i] * muY[i];
            double cov = eXY[i] - muX[i] * muY[i];
            double ssim = ((2 * muX[i] * muY[i] + c1) * (2 * cov + c2))
                    / ((muX[i] * muX[i] + muY[i] * muY[i] + c1) * (varX + varY + c2));
            ssimSum += ssim;
            dissimilarity[i] = 1.0 - ssim;
        }

        Map<String, Double> stats = new LinkedHashMap<>();
        stats.put("overallSsim", ssimSum / n);
        return new ChangeSignal(getType(), ChangeMap.normalize(w, h, dissimilarity), stats);
    }
}
