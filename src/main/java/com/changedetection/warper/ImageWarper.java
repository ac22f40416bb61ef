package com.changedetection.warper;

import com.changedetection.imageOperator.Image;
import com.changedetection.imageOperator.ImageConverter;
import com.changedetection.matchAndTransform.Transform;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.bytedeco.opencv.opencv_core.Size;

import static org.bytedeco.opencv.global.opencv_core.BORDER_CONSTANT;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_LINEAR;
import static org.bytedeco.opencv.global.opencv_imgproc.warpAffine;

/**
 * Resamples a moving image onto the pixel grid of the fixed image.
 */
public class ImageWarper {

    /**
     * Bilinear resampling of every band; samples falling outside the moving image are zero.
     *
     * @param moving    image to resample
     * @param transform maps moving coordinates into the output frame
     * @param width     output width (the fixed image's)
     * @param height    output height (the fixed image's)
     */
    public Image warp(Image moving, Transform transform, int width, int height) {
        Mat matrix = transform.toMat();
        Size size = new Size(width, height);
        float[][] bands = new float[moving.getBandCount()][];
        for (int b = 0; b < moving.getBandCount(); b++) {
            Mat src = ImageConverter.bandToMat(moving, b);
            Mat dst = new Mat();
            warpAffine(src, dst, matrix, size, INTER_LINEAR, BORDER_CONSTANT, new Scalar(0.0));
            bands[b] = ImageConverter.toArray(dst);
            src.release();
            dst.release();
        }
        matrix.release();
        return ImageConverter.fromBands(width, height, moving.getMaxValue(), bands);
    }

    /**
     * Places the moving image unchanged on the output grid, cropping or zero padding.
     */
    public Image fitToFrame(Image moving, int width, int height) {
        if (moving.getWidth() == width && moving.getHeight() == height) return moving;
        float[][] bands = new float[moving.getBandCount()][width * height];
        int w = Math.min(width, moving.getWidth()), h = Math.min(height, moving.getHeight());
        for (int b = 0; b < bands.length; b++) {
            float[] src = moving.band(b);
            for (int y = 0; y < h; y++) {
                System.arraycopy(src, y * moving.getWidth(), bands[b], y * width, w);
            }
        }
        return ImageConverter.fromBands(width, height, moving.getMaxValue(), bands);
    }
}
