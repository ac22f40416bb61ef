package com.changedetection.alignment;

import com.changedetection.exception.AlignmentException;
import com.changedetection.exception.DegenerateModelException;
import com.changedetection.imageOperator.Image;
import com.changedetection.imageOperator.ImageConverter;
import com.changedetection.matchAndTransform.Transform;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.TermCriteria;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_video.MOTION_AFFINE;
import static org.bytedeco.opencv.global.opencv_video.findTransformECC;

/**
 * Keypoint-free registration: maximises the enhanced correlation coefficient between the two
 * grayscale images over affine parameters, with a bounded iteration count.
 */
@Slf4j
public class IntensityAlignmentStrategy implements AlignmentStrategy {
    private static final String STAGE = "intensity registration";

    private final IntensityParameters params;

    public IntensityAlignmentStrategy(IntensityParameters params) {
        this.params = params;
    }

    public IntensityAlignmentStrategy() {
        this(new IntensityParameters());
    }

    @Override
    public AlignmentStrategyName getName() {
        return AlignmentStrategyName.INTENSITY;
    }

    @Override
    public AlignmentEstimate estimate(Image fixed, Image moving) throws AlignmentException {
        float[] grayFixed = normalizedGray(fixed);
        float[] grayMoving = normalizedGray(moving);
        if (stdDev(grayFixed) < params.getMinStdDev() || stdDev(grayMoving) < params.getMinStdDev()) {
            throw new DegenerateModelException(STAGE, "image has no intensity variation", null);
        }

        Mat template = ImageConverter.toMat(grayFixed, fixed.getWidth(), fixed.getHeight());
        Mat input = ImageConverter.toMat(grayMoving, moving.getWidth(), moving.getHeight());
        Mat warp = Mat.eye(2, 3, CV_32F).asMat();
        TermCriteria criteria = new TermCriteria(TermCriteria.COUNT + TermCriteria.EPS,
                params.getMaxIterations(), params.getEpsilon());
        double correlation;
        try {
            correlation = findTransformECC(template, input, warp, MOTION_AFFINE, criteria, new Mat(),
                    params.getGaussFilterSize());
        } catch (RuntimeException e) {
            throw new DegenerateModelException(STAGE, "did not converge: " + e.getMessage(), e);
        } finally {
            template.release();
            input.release();
        }

        // ECC maps fixed coordinates into the moving image, the pipeline needs the opposite
        Transform fixedToMoving = Transform.fromMat(warp);
        warp.release();
        if (!(correlation >= params.getMinCorrelation())) {
            throw new DegenerateModelException(STAGE, 0, fixedToMoving.determinant(),
                    String.format("correlation %.3f below %.3f", correlation, params.getMinCorrelation()));
        }
        double det = fixedToMoving.determinant();
        if (!fixedToMoving.isFinite() || det <= 0 || Math.abs(det - 1.0) > params.getMaxDeterminantDeviation()) {
            throw new DegenerateModelException(STAGE, 0, det, "scale change out of bounds");
        }

        log.debug("{}: correlation {}, transform {}", STAGE, correlation, fixedToMoving);
        return new AlignmentEstimate(fixedToMoving.inverse(), 0, 0, 0, 0, Double.NaN, correlation);
    }

    private static float[] normalizedGray(Image image) {
        float[] gray = image.toGray();
        float scale = (float) (1.0 / image.getMaxValue());
        for (int i = 0; i < gray.length; i++) gray[i] *= scale;
        return gray;
    }

    private static double stdDev(float[] values) {
        double sum = 0, sumSq = 0;
        for (float v : values) {
            sum += v;
            sumSq += (double) v * v;
        }
        double mean = sum / values.length;
        return Math.sqrt(Math.max(0, sumSq / values.length - mean * mean));
    }
}
