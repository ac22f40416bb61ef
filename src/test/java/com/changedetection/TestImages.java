package com.changedetection;

import com.changedetection.imageOperator.Image;
import com.changedetection.imageOperator.SeparableFilter;
import com.changedetection.matchAndTransform.Transform;
import com.changedetection.warper.ImageWarper;

import java.util.Random;

/**
 * Seeded synthetic scenes for tests.
 */
public final class TestImages {

    private TestImages() {
    }

    /**
     * Gradient background with random rectangles and discs, lightly blurred. Rich in corners
     * and blobs, so every keypoint method finds plenty of features.
     */
    public static Image scene(int width, int height, long seed) {
        Random random = new Random(seed);
        double[] data = new double[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                data[y * width + x] = 60 + 40.0 * x / width + 20.0 * y / height;
            }
        }
        int shapes = Math.max(20, width * height / 1000);
        for (int s = 0; s < shapes; s++) {
            double value = 20 + random.nextInt(216);
            int cx = random.nextInt(width), cy = random.nextInt(height);
            int size = 4 + random.nextInt(Math.max(5, Math.min(width, height) / 8));
            boolean disc = random.nextBoolean();
            for (int y = Math.max(0, cy - size); y < Math.min(height, cy + size); y++) {
                for (int x = Math.max(0, cx - size); x < Math.min(width, cx + size); x++) {
                    int dx = x - cx, dy = y - cy;
                    if (!disc || dx * dx + dy * dy <= size * size) data[y * width + x] = value;
                }
            }
        }
        double[] blurred = SeparableFilter.gaussian(data, width, height, 1.0);
        float[] out = new float[blurred.length];
        for (int i = 0; i < out.length; i++) out[i] = (float) Math.max(0, Math.min(255, blurred[i]));
        return Image.gray(width, height, out);
    }

    /**
     * Three band (BGR) scene whose bands are scaled copies of a gray scene.
     */
    public static Image colorScene(int width, int height, long seed) {
        float[] gray = scene(width, height, seed).band(0);
        float[] b = new float[gray.length], g = new float[gray.length], r = new float[gray.length];
        for (int i = 0; i < gray.length; i++) {
            b[i] = 0.5f * gray[i];
            g[i] = 0.8f * gray[i];
            r[i] = gray[i];
        }
        return Image.of(width, height, 255.0, b, g, r);
    }

    /**
     * Copy of {@code base} with {@code delta} added to every band inside a square block.
     */
    public static Image withBlock(Image base, int x0, int y0, int size, float delta) {
        float[][] bands = new float[base.getBandCount()][];
        for (int b = 0; b < bands.length; b++) {
            float[] band = base.band(b);
            for (int y = y0; y < y0 + size; y++) {
                for (int x = x0; x < x0 + size; x++) band[y * base.getWidth() + x] += delta;
            }
            bands[b] = band;
        }
        return Image.of(base.getWidth(), base.getHeight(), base.getMaxValue(), bands);
    }

    /**
     * Moves the content by (dx, dy), filling uncovered pixels with zero.
     */
    public static Image shifted(Image base, double dx, double dy) {
        return new ImageWarper().warp(base, Transform.translation(dx, dy), base.getWidth(), base.getHeight());
    }
}
