package com.changedetection.imageOperator;

/**
 * Separable smoothing in double precision on row-major planes, replicating edge pixels.
 * Used where the per-pixel statistics must not pick up float round-off.
 */
public final class SeparableFilter {

    private SeparableFilter() {
    }

    /**
     * Normalised 1D Gaussian of the given odd size.
     */
    static double[] gaussianKernel(int size, double sigma) {
        int radius = size / 2;
        double[] kernel = new double[size];
        double sum = 0;
        for (int i = 0; i < size; i++) {
            int d = i - radius;
            kernel[i] = Math.exp(-(d * d) / (2 * sigma * sigma));
            sum += kernel[i];
        }
        for (int i = 0; i < size; i++) kernel[i] /= sum;
        return kernel;
    }

    /**
     * Gaussian blur with a kernel of radius ceil(3 sigma).
     */
    public static double[] gaussian(double[] plane, int width, int height, double sigma) {
        if (!(sigma > 0)) throw new IllegalArgumentException("sigma must be positive: " + sigma);
        int radius = (int) Math.ceil(3 * sigma);
        return convolve(plane, width, height, gaussianKernel(2 * radius + 1, sigma));
    }

    /**
     * Gaussian blur with an explicit window size.
     */
    public static double[] gaussian(double[] plane, int width, int height, int window, double sigma) {
        if (window < 1 || window % 2 == 0) throw new IllegalArgumentException("window must be odd: " + window);
        return convolve(plane, width, height, gaussianKernel(window, sigma));
    }

    /**
     * Mean over a square window.
     */
    public static double[] boxMean(double[] plane, int width, int height, int window) {
        if (window < 1 || window % 2 == 0) throw new IllegalArgumentException("window must be odd: " + window);
        double[] kernel = new double[window];
        java.util.Arrays.fill(kernel, 1.0 / window);
        return convolve(plane, width, height, kernel);
    }

    private static double[] convolve(double[] plane, int width, int height, double[] kernel) {
        int radius = kernel.length / 2;
        double[] temp = new double[plane.length];
        double[] out = new double[plane.length];

        // horizontal pass
        for (int y = 0; y < height; y++) {
            int row = y * width;
            for (int x = 0; x < width; x++) {
                double sum = 0;
                for (int k = 0; k < kernel.length; k++) {
                    int px = x + k - radius;
                    if (px < 0) px = 0;
                    if (px >= width) px = width - 1;
                    sum += plane[row + px] * kernel[k];
                }
                temp[row + x] = sum;
            }
        }

        // vertical pass
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double sum = 0;
                for (int k = 0; k < kernel.length; k++) {
                    int py = y + k - radius;
                    if (py < 0) py = 0;
                    if (py >= height) py = height - 1;
                    sum += temp[py * width + x] * kernel[k];
                }
                out[y * width + x] = sum;
            }
        }
        return out;
    }

    public static double[] toDouble(float[] values) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) out[i] = values[i];
        return out;
    }
}
