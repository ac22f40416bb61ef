package com.changedetection.changeSignal;

import com.changedetection.exception.DimensionMismatchException;
import com.changedetection.imageOperator.Image;

final class Images {

    private Images() {
    }

    static void requireSameShape(Image a, Image b) {
        if (!a.hasSameShape(b)) {
            throw new DimensionMismatchException(a.describeShape(), b.describeShape());
        }
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return values.length == 0 ? 0 : sum / values.length;
    }

    static double std(double[] values) {
        double mean = mean(values), sum = 0;
        for (double v : values) sum += (v - mean) * (v - mean);
        return values.length < 2 ? 0 : Math.sqrt(sum / (values.length - 1));
    }
}
