package com.changedetection.changeSignal;

import lombok.Getter;

/**
 * Per-pixel degree of change in [0,1], same extent as the aligned pair.
 */
@Getter
public final class ChangeMap {
    private final int width;
    private final int height;
    @Getter(lombok.AccessLevel.NONE)
    private final float[] values;

    private ChangeMap(int width, int height, float[] values) {
        if (values.length != width * height) {
            throw new IllegalArgumentException("Expected " + (width * height) + " values, got " + values.length);
        }
        this.width = width;
        this.height = height;
        this.values = values;
    }

    /**
     * Wraps values that are already in [0,1]; values outside are clamped.
     */
    public static ChangeMap of(int width, int height, float[] values) {
        float[] copy = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            float v = values[i];
            copy[i] = Float.isNaN(v) ? 0f : Math.max(0f, Math.min(1f, v));
        }
        return new ChangeMap(width, height, copy);
    }

    /**
     * Min-max scales raw detector output to [0,1]. A constant input maps to all zeros.
     */
    public static ChangeMap normalize(int width, int height, float[] raw) {
        float min = Float.POSITIVE_INFINITY, max = Float.NEGATIVE_INFINITY;
        for (float v : raw) {
            if (Float.isNaN(v)) continue;
            if (v < min) min = v;
            if (v > max) max = v;
        }
        float[] out = new float[raw.length];
        float range = max - min;
        if (!(range > 1e-6f)) return new ChangeMap(width, height, out);
        for (int i = 0; i < raw.length; i++) {
            out[i] = Float.isNaN(raw[i]) ? 0f : (raw[i] - min) / range;
        }
        return new ChangeMap(width, height, out);
    }

    public static ChangeMap normalize(int width, int height, double[] raw) {
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double v : raw) {
            if (Double.isNaN(v)) continue;
            if (v < min) min = v;
            if (v > max) max = v;
        }
        float[] out = new float[raw.length];
        double range = max - min;
        if (!(range > 1e-9)) return new ChangeMap(width, height, out);
        for (int i = 0; i < raw.length; i++) {
            out[i] = Double.isNaN(raw[i]) ? 0f : (float) ((raw[i] - min) / range);
        }
        return new ChangeMap(width, height, out);
    }

    public float get(int x, int y) {
        return values[y * width + x];
    }

    public float get(int index) {
        return values[index];
    }

    public int size() {
        return values.length;
    }

    public float[] values() {
        return values.clone();
    }

    public double mean() {
        double sum = 0;
        for (float v : values) sum += v;
        return values.length == 0 ? 0 : sum / values.length;
    }

    public ChangeMask threshold(double threshold) {
        boolean[] mask = new boolean[values.length];
        for (int i = 0; i < values.length; i++) mask[i] = values[i] > threshold;
        return ChangeMask.of(width, height, mask);
    }
}
