package com.changedetection.imageOperator;

import com.changedetection.changeSignal.ChangeMask;
import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.*;

/**
 * Moves pixel data between {@link Image} and OpenCV matrices.
 */
public final class ImageConverter {

    private ImageConverter() {
    }

    public static Image fromMat(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new IllegalArgumentException("Cannot convert an empty matrix");
        }
        double maxValue;
        int depth = mat.depth();
        if (depth == CV_8U) maxValue = 255.0;
        else if (depth == CV_16U) maxValue = 65535.0;
        else maxValue = 1.0;

        Mat floats = new Mat();
        mat.convertTo(floats, CV_32F);
        int width = floats.cols(), height = floats.rows(), channels = floats.channels();
        float[] interleaved = new float[width * height * channels];
        new FloatPointer(floats.data()).get(interleaved);
        floats.release();

        float[][] bands = new float[channels][width * height];
        for (int i = 0, p = 0; i < width * height; i++) {
            for (int c = 0; c < channels; c++) bands[c][i] = interleaved[p++];
        }
        return Image.wrap(width, height, maxValue, bands);
    }

    public static Image fromBands(int width, int height, double maxValue, float[][] bands) {
        return Image.wrap(width, height, maxValue, bands);
    }

    /**
     * Interleaved CV_32F matrix holding all bands.
     */
    public static Mat toMat(Image image) {
        int w = image.getWidth(), h = image.getHeight(), channels = image.getBandCount();
        float[] interleaved = new float[w * h * channels];
        for (int c = 0; c < channels; c++) {
            float[] band = image.bandView(c);
            for (int i = 0; i < w * h; i++) interleaved[i * channels + c] = band[i];
        }
        Mat mat = new Mat(h, w, CV_MAKETYPE(CV_32F, channels));
        new FloatPointer(mat.data()).put(interleaved);
        return mat;
    }

    public static Mat toMat(float[] data, int width, int height) {
        Mat mat = new Mat(height, width, CV_32F);
        new FloatPointer(mat.data()).put(data);
        return mat;
    }

    public static Mat bandToMat(Image image, int band) {
        return toMat(image.bandView(band), image.getWidth(), image.getHeight());
    }

    public static Mat grayToMat(Image image) {
        return toMat(image.toGray(), image.getWidth(), image.getHeight());
    }

    /**
     * Grayscale rescaled to 0..255 and saturated to 8 bits, the input most detectors expect.
     */
    public static Mat toGray8U(Image image) {
        Mat gray = grayToMat(image);
        Mat out = new Mat();
        gray.convertTo(out, CV_8U, 255.0 / image.getMaxValue(), 0.0);
        gray.release();
        return out;
    }

    public static float[] toArray(Mat mat) {
        Mat floats = mat;
        if (mat.type() != CV_32F) {
            floats = new Mat();
            mat.convertTo(floats, CV_32F);
        } else if (!mat.isContinuous()) {
            floats = mat.clone();
        }
        float[] data = new float[floats.rows() * floats.cols()];
        new FloatPointer(floats.data()).get(data);
        if (floats != mat) floats.release();
        return data;
    }

    public static Mat toMat(ChangeMask mask) {
        int n = mask.getWidth() * mask.getHeight();
        byte[] data = new byte[n];
        for (int i = 0; i < n; i++) data[i] = mask.get(i) ? (byte) 255 : 0;
        Mat mat = new Mat(mask.getHeight(), mask.getWidth(), CV_8U);
        mat.data().put(data);
        return mat;
    }

    public static boolean[] toBooleans(Mat mat8u) {
        Mat src = mat8u.isContinuous() ? mat8u : mat8u.clone();
        byte[] data = new byte[src.rows() * src.cols()];
        src.data().get(data);
        boolean[] out = new boolean[data.length];
        for (int i = 0; i < data.length; i++) out[i] = data[i] != 0;
        return out;
    }
}
