package com.changedetection.fusion;

import com.changedetection.changeSignal.ChangeMask;
import com.changedetection.imageOperator.ImageConverter;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Fixed cleanup pipeline for a thresholded mask: small component removal, optional hole
 * filling, closing, opening.
 */
public class MaskCleanup {
    private static final int[] DX8 = {-1, 0, 1, -1, 1, -1, 0, 1};
    private static final int[] DY8 = {-1, -1, -1, 0, 0, 1, 1, 1};
    private static final int[] DX4 = {0, -1, 1, 0};
    private static final int[] DY4 = {-1, 0, 0, 1};

    public ChangeMask clean(ChangeMask mask, CleanupParameters params) {
        params.validate();
        int w = mask.getWidth(), h = mask.getHeight();
        boolean[] pixels = mask.values();
        if (params.getMinArea() > 1) removeSmallComponents(pixels, w, h, params.getMinArea());
        if (params.isFillHoles()) fillHoles(pixels, w, h);
        pixels = morphology(pixels, w, h, MORPH_CLOSE, params.getClosingRadius());
        pixels = morphology(pixels, w, h, MORPH_OPEN, params.getOpeningRadius());
        return ChangeMask.of(w, h, pixels);
    }

    static void removeSmallComponents(boolean[] pixels, int w, int h, int minArea) {
        boolean[] visited = new boolean[pixels.length];
        int[] queue = new int[pixels.length];
        for (int start = 0; start < pixels.length; start++) {
            if (!pixels[start] || visited[start]) continue;
            int head = 0, tail = 0;
            queue[tail++] = start;
            visited[start] = true;
            while (head < tail) {
                int p = queue[head++];
                int x = p % w, y = p / w;
                for (int k = 0; k < 8; k++) {
                    int nx = x + DX8[k], ny = y + DY8[k];
                    if (nx < 0 || ny < 0 || nx >= w || ny >= h) continue;
                    int q = ny * w + nx;
                    if (pixels[q] && !visited[q]) {
                        visited[q] = true;
                        queue[tail++] = q;
                    }
                }
            }
            // queue[0..tail) holds the component
            if (tail < minArea) {
                for (int i = 0; i < tail; i++) pixels[queue[i]] = false;
            }
        }
    }

    /**
     * Sets every background pixel not 4-connected to the image border.
     */
    static void fillHoles(boolean[] pixels, int w, int h) {
        boolean[] outside = new boolean[pixels.length];
        int[] queue = new int[pixels.length];
        int head = 0, tail = 0;
        for (int x = 0; x < w; x++) {
            tail = seed(pixels, outside, queue, tail, x);
            tail = seed(pixels, outside, queue, tail, (h - 1) * w + x);
        }
        for (int y = 0; y < h; y++) {
            tail = seed(pixels, outside, queue, tail, y * w);
            tail = seed(pixels, outside, queue, tail, y * w + w - 1);
        }
        while (head < tail) {
            int p = queue[head++];
            int x = p % w, y = p / w;
            for (int k = 0; k < 4; k++) {
                int nx = x + DX4[k], ny = y + DY4[k];
                if (nx < 0 || ny < 0 || nx >= w || ny >= h) continue;
                tail = seed(pixels, outside, queue, tail, ny * w + nx);
            }
        }
        for (int i = 0; i < pixels.length; i++) {
            if (!outside[i]) pixels[i] = true;
        }
    }

    private static int seed(boolean[] pixels, boolean[] outside, int[] queue, int tail, int p) {
        if (pixels[p] || outside[p]) return tail;
        outside[p] = true;
        queue[tail] = p;
        return tail + 1;
    }

    private static boolean[] morphology(boolean[] pixels, int w, int h, int op, int radius) {
        if (radius == 0) return pixels;
        Mat src = ImageConverter.toMat(ChangeMask.of(w, h, pixels));
        Mat dst = new Mat();
        Mat kernel = getStructuringElement(MORPH_ELLIPSE, new Size(2 * radius + 1, 2 * radius + 1));
        try {
            morphologyEx(src, dst, op, kernel);
            return ImageConverter.toBooleans(dst);
        } finally {
            src.release();
            dst.release();
            kernel.release();
        }
    }
}
