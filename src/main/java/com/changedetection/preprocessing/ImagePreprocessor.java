package com.changedetection.preprocessing;

import com.changedetection.imageOperator.Image;
import com.changedetection.imageOperator.ImageConverter;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.MatVector;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_imgproc.CLAHE;

import java.util.Arrays;

import static org.bytedeco.opencv.global.opencv_core.*;
import static org.bytedeco.opencv.global.opencv_imgproc.*;

/**
 * Radiometric preparation of an image before alignment and change detection.
 * Every method returns an 8-bit range image (max value 255).
 */
@Slf4j
public class ImagePreprocessor {
    private static final double MAD_TO_SIGMA = 0.6745;
    // 3x3 Laplacian with alpha = 0.2
    private static final double[] LAPLACIAN = {
            1.0 / 6, 2.0 / 3, 1.0 / 6,
            2.0 / 3, -10.0 / 3, 2.0 / 3,
            1.0 / 6, 2.0 / 3, 1.0 / 6};

    public Image preprocess(Image image) {
        return preprocess(image, PreprocessMethod.AUTO, new PreprocessParameters());
    }

    public Image preprocess(Image image, PreprocessMethod method, PreprocessParameters params) {
        params.validate();
        Image img = to8BitRange(image);
        switch (method) {
            case AUTO:
                return auto(img, params);
            case ENHANCE:
                return enhance(img, params);
            case DENOISE:
                return denoise(img, params);
            case NORMALIZE:
                return normalize(img);
            case MULTISPECTRAL:
                return multispectral(img, params);
            default:
                throw new IllegalArgumentException("Unknown preprocessing method " + method);
        }
    }

    private Image auto(Image img, PreprocessParameters params) {
        Image out;
        if (img.getBandCount() == 1) {
            out = claheGray(img, params);
        } else if (img.getBandCount() == 3) {
            out = claheColor(img, params);
        } else {
            out = multispectral(img, params);
        }
        double noise = noiseEstimate(out);
        if (noise > params.getNoiseThreshold()) {
            log.debug("Noise estimate {} above {}, denoising", noise, params.getNoiseThreshold());
            out = denoise(out, params);
        }
        return enhance(out, params);
    }

    /**
     * Stretches each band so that its low and high percentiles span the full range.
     */
    Image enhance(Image img, PreprocessParameters params) {
        int bands = img.getBandCount();
        float[][] out = new float[bands][];
        for (int b = 0; b < bands; b++) {
            float[] band = img.band(b);
            float[] sorted = band.clone();
            Arrays.sort(sorted);
            double lo = percentile(sorted, params.getStretchLow());
            double hi = percentile(sorted, params.getStretchHigh());
            double range = hi - lo;
            for (int i = 0; i < band.length; i++) {
                double v = range > 0 ? (band[i] - lo) / range : 0.0;
                band[i] = (float) (255.0 * Math.max(0.0, Math.min(1.0, v)));
            }
            out[b] = band;
        }
        return Image.of(img.getWidth(), img.getHeight(), 255.0, out);
    }

    Image denoise(Image img, PreprocessParameters params) {
        int bands = img.getBandCount();
        float[][] out = new float[bands][];
        for (int b = 0; b < bands; b++) {
            Mat band = ImageConverter.bandToMat(img, b);
            Mat band8u = new Mat();
            Mat filtered = new Mat();
            band.convertTo(band8u, CV_8U);
            medianBlur(band8u, filtered, params.getFilterSize());
            out[b] = ImageConverter.toArray(filtered);
            band.release();
            band8u.release();
            filtered.release();
        }
        return Image.of(img.getWidth(), img.getHeight(), 255.0, out);
    }

    Image normalize(Image img) {
        int bands = img.getBandCount();
        float[][] out = new float[bands][];
        for (int b = 0; b < bands; b++) {
            float[] band = img.band(b);
            float min = Float.POSITIVE_INFINITY, max = Float.NEGATIVE_INFINITY;
            for (float v : band) {
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            float range = max - min;
            for (int i = 0; i < band.length; i++) {
                band[i] = range > 0 ? 255f * (band[i] - min) / range : 0f;
            }
            out[b] = band;
        }
        return Image.of(img.getWidth(), img.getHeight(), 255.0, out);
    }

    /**
     * Selects the configured band combination (first three bands when it does not fit),
     * normalises and stretches it.
     */
    Image multispectral(Image img, PreprocessParameters params) {
        int bands = img.getBandCount();
        int[] selected;
        int[] combination = params.getBandCombination();
        if (bands >= 4 && Arrays.stream(combination).allMatch(c -> c >= 1 && c <= bands)) {
            selected = new int[]{combination[0] - 1, combination[1] - 1, combination[2] - 1};
        } else {
            selected = bands >= 3 ? new int[]{0, 1, 2} : new int[]{0};
        }
        float[][] out = new float[selected.length][];
        for (int i = 0; i < selected.length; i++) out[i] = img.band(selected[i]);
        Image composite = Image.of(img.getWidth(), img.getHeight(), img.getMaxValue(), out);
        return enhance(normalize(composite), params);
    }

    private Image claheGray(Image img, PreprocessParameters params) {
        Mat gray = ImageConverter.toGray8U(img);
        Mat equalized = new Mat();
        CLAHE clahe = createClahe(params);
        clahe.apply(gray, equalized);
        float[] data = ImageConverter.toArray(equalized);
        gray.release();
        equalized.release();
        clahe.close();
        return Image.gray(img.getWidth(), img.getHeight(), data);
    }

    /**
     * Equalises lightness in Lab space, leaving chroma untouched. Bands are in BGR order.
     */
    private Image claheColor(Image img, PreprocessParameters params) {
        Mat floats = ImageConverter.toMat(img);
        Mat bgr = new Mat();
        floats.convertTo(bgr, CV_8U);
        Mat lab = new Mat();
        cvtColor(bgr, lab, COLOR_BGR2Lab);
        MatVector channels = new MatVector();
        split(lab, channels);
        CLAHE clahe = createClahe(params);
        Mat lightness = new Mat();
        clahe.apply(channels.get(0), lightness);
        channels.put(0, lightness);
        merge(channels, lab);
        cvtColor(lab, bgr, COLOR_Lab2BGR);

        Image out = ImageConverter.fromMat(bgr);
        floats.release();
        bgr.release();
        lab.release();
        lightness.release();
        clahe.close();
        return out;
    }

    private CLAHE createClahe(PreprocessParameters params) {
        return createCLAHE(params.getClipLimit(), new Size(params.getTileGridSize(), params.getTileGridSize()));
    }

    /**
     * Robust noise sigma from the median absolute deviation of the Laplacian response.
     */
    static double noiseEstimate(Image img) {
        int w = img.getWidth(), h = img.getHeight();
        float[] gray = img.toGray();
        double[] response = new double[gray.length];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double sum = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    int py = Math.max(0, Math.min(h - 1, y + dy));
                    for (int dx = -1; dx <= 1; dx++) {
                        int px = Math.max(0, Math.min(w - 1, x + dx));
                        sum += LAPLACIAN[(dy + 1) * 3 + dx + 1] * gray[py * w + px];
                    }
                }
                response[y * w + x] = sum;
            }
        }
        double median = median(response);
        double[] deviation = new double[response.length];
        for (int i = 0; i < response.length; i++) deviation[i] = Math.abs(response[i] - median);
        return median(deviation) / MAD_TO_SIGMA;
    }

    private static Image to8BitRange(Image image) {
        if (image.getMaxValue() == 255.0) return image;
        double scale = 255.0 / image.getMaxValue();
        float[][] out = new float[image.getBandCount()][];
        for (int b = 0; b < out.length; b++) {
            float[] band = image.band(b);
            for (int i = 0; i < band.length; i++) band[i] = (float) (band[i] * scale);
            out[b] = band;
        }
        return Image.of(image.getWidth(), image.getHeight(), 255.0, out);
    }

    private static double percentile(float[] sorted, double percent) {
        double pos = (sorted.length - 1) * percent / 100.0;
        int lower = (int) Math.floor(pos);
        int upper = Math.min(sorted.length - 1, lower + 1);
        return sorted[lower] + (pos - lower) * (sorted[upper] - sorted[lower]);
    }

    private static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        return n % 2 == 1 ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2;
    }
}
