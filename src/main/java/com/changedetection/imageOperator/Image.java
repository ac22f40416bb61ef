package com.changedetection.imageOperator;

import com.changedetection.exception.UnsupportedBandCountException;
import lombok.Getter;

import java.util.Arrays;

/**
 * Immutable raster: one float array per band, row-major, in the source's intensity units.
 * Three band images follow the OpenCV channel order (B, G, R).
 */
@Getter
public final class Image {
    private final int width;
    private final int height;
    private final double maxValue;
    @Getter(lombok.AccessLevel.NONE)
    private final float[][] bands;

    private Image(int width, int height, double maxValue, float[][] bands) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image size must be positive: " + width + "x" + height);
        }
        if (bands.length == 0 || bands.length == 2) {
            throw new UnsupportedBandCountException("Image", bands.length, "expected 1 or at least 3 bands");
        }
        for (float[] band : bands) {
            if (band.length != width * height) {
                throw new IllegalArgumentException("Band length " + band.length + " does not match " + width + "x" + height);
            }
        }
        this.width = width;
        this.height = height;
        this.maxValue = maxValue;
        this.bands = bands;
    }

    /**
     * Copies the given bands into a new image.
     */
    public static Image of(int width, int height, double maxValue, float[]... bands) {
        float[][] copy = new float[bands.length][];
        for (int b = 0; b < bands.length; b++) copy[b] = bands[b].clone();
        return new Image(width, height, maxValue, copy);
    }

    /**
     * 8-bit style grayscale image.
     */
    public static Image gray(int width, int height, float[] data) {
        return of(width, height, 255.0, data);
    }

    public static Image constant(int width, int height, int bandCount, float value) {
        float[][] bands = new float[bandCount][width * height];
        for (float[] band : bands) Arrays.fill(band, value);
        return new Image(width, height, 255.0, bands);
    }

    // takes ownership of the arrays, callers in this package must not keep them
    static Image wrap(int width, int height, double maxValue, float[][] bands) {
        return new Image(width, height, maxValue, bands);
    }

    public int getBandCount() {
        return bands.length;
    }

    public float get(int x, int y, int band) {
        return bands[band][y * width + x];
    }

    public float[] band(int band) {
        return bands[band].clone();
    }

    float[] bandView(int band) {
        return bands[band];
    }

    /**
     * Luminance for three band images (BGR weights), band mean for any other band count.
     */
    public float[] toGray() {
        if (bands.length == 1) return bands[0].clone();
        int n = width * height;
        float[] gray = new float[n];
        if (bands.length == 3) {
            float[] b = bands[0], g = bands[1], r = bands[2];
            for (int i = 0; i < n; i++) {
                gray[i] = (float) (0.114 * b[i] + 0.587 * g[i] + 0.299 * r[i]);
            }
        } else {
            for (float[] band : bands) {
                for (int i = 0; i < n; i++) gray[i] += band[i];
            }
            for (int i = 0; i < n; i++) gray[i] /= bands.length;
        }
        return gray;
    }

    public boolean hasSameShape(Image other) {
        return width == other.width && height == other.height && bands.length == other.bands.length;
    }

    public String describeShape() {
        return width + "x" + height + "x" + bands.length;
    }

    @Override
    public String toString() {
        return "Image[" + describeShape() + ", max=" + maxValue + "]";
    }
}
