package com.changedetection.changeSignal;

import com.changedetection.exception.UnsupportedBandCountException;
import com.changedetection.imageOperator.Image;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Angle between the band vectors of each pixel. Insensitive to uniform brightness changes,
 * sensitive to changes in spectral composition. Needs multi-band input.
 */
public class SpectralAngleSignal implements ChangeSignalDetector {

    @Override
    public SignalType getType() {
        return SignalType.SPECTRAL_ANGLE;
    }

    @Override
    public ChangeSignal compute(Image before, Image after, SignalParameters params) {
        Images.requireSameShape(before, after);
        int bands = before.getBandCount();
        if (bands < 3) {
            throw new UnsupportedBandCountException("spectral angle", bands, "needs at least 3 bands");
        }
        int w = before.getWidth(), h = before.getHeight();
        float[][] b1 = new float[bands][];
        float[][] b2 = new float[bands][];
        for (int b = 0; b < bands; b++) {
            b1[b] = before.band(b);
            b2[b] = after.band(b);
        }

        double[] angles = new double[w * h];
        IntStream.range(0, angles.length).parallel().forEach(i -> angles[i] = angle(b1, b2, i));

        Map<String, Double> stats = new LinkedHashMap<>();
        stats.put("meanSpectralAngle", Images.mean(angles));
        stats.put("bands", (double) bands);
        return new ChangeSignal(getType(), ChangeMap.normalize(w, h, angles), stats);
    }

    /**
     * Angle in radians. Two black pixels are unchanged; black against non-black is orthogonal.
     */
    static double angle(float[][] v1, float[][] v2, int pixel) {
        double dot = 0, n1 = 0, n2 = 0;
        for (int b = 0; b < v1.length; b++) {
            double a = v1[b][pixel], c = v2[b][pixel];
            dot += a * c;
            n1 += a * a;
            n2 += c * c;
        }
        if (n1 == 0 && n2 == 0) return 0.0;
        if (n1 == 0 || n2 == 0) return Math.PI / 2;
        double cos = dot / Math.sqrt(n1 * n2);
        return Math.acos(Math.max(-1.0, Math.min(1.0, cos)));
    }
}
