package com.changedetection.matchAndTransform;

import com.changedetection.exception.DegenerateModelException;
import com.changedetection.exception.InsufficientTrialsException;
import lombok.extern.slf4j.Slf4j;
import org.bytedeco.javacpp.DoublePointer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.bytedeco.opencv.global.opencv_core.CV_64F;
import static org.bytedeco.opencv.global.opencv_core.DECOMP_LU;
import static org.bytedeco.opencv.global.opencv_core.DECOMP_NORMAL;
import static org.bytedeco.opencv.global.opencv_core.solve;

/**
 * RANSAC estimation of a similarity or affine transform from correspondences
 * (moving point B to fixed point A), followed by a least-squares refit on the inliers.
 */
@Slf4j
public class RobustTransformEstimator {
    private static final String STAGE = "RANSAC";

    private final Random random;

    public RobustTransformEstimator(Random random) {
        this.random = random;
    }

    public RobustTransformEstimator(long seed) {
        this(new Random(seed));
    }

    public TransformEstimate estimate(List<Correspondence> correspondences, RansacParameters params)
            throws DegenerateModelException, InsufficientTrialsException {
        params.validate();
        ModelFamily family = params.getModelFamily();
        int n = correspondences.size();
        int sampleSize = family.getMinimalSampleSize();
        // a minimal sample always fits itself, the consensus needs at least one more point
        int requiredInliers = Math.max(sampleSize + 1, (int) Math.ceil(params.getMinInlierFraction() * n));
        if (n < requiredInliers) {
            throw new InsufficientTrialsException(STAGE, 0, requiredInliers, 0);
        }

        double maxResidualSq = params.getMaxResidual() * params.getMaxResidual();
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) indices[i] = i;

        boolean[] bestMask = null;
        int bestCount = 0;
        int trialsNeeded = params.getMaxTrials();
        int trial = 0;
        List<Correspondence> sample = new ArrayList<>(sampleSize);

        while (trial < trialsNeeded) {
            trial++;
            drawSample(indices, sampleSize);
            sample.clear();
            for (int k = 0; k < sampleSize; k++) sample.add(correspondences.get(indices[k]));

            Transform model = fit(sample, family);
            if (model == null) continue;

            boolean[] mask = new boolean[n];
            int count = score(model, correspondences, maxResidualSq, mask);
            if (count > bestCount) {
                bestCount = count;
                bestMask = mask;
                trialsNeeded = Math.min(params.getMaxTrials(),
                        requiredTrials((double) count / n, sampleSize, params.getConfidence(), trial));
            }
        }
        log.debug("{}: {} trials, best consensus {}/{}", STAGE, trial, bestCount, n);

        if (bestMask == null || bestCount < requiredInliers) {
            throw new InsufficientTrialsException(STAGE, bestCount, requiredInliers, trial);
        }

        Transform refit = fit(select(correspondences, bestMask), family);
        if (refit == null) {
            throw new DegenerateModelException(STAGE, bestCount, Double.NaN, "inlier set is singular");
        }
        boolean[] refitMask = new boolean[n];
        int refitCount = score(refit, correspondences, maxResidualSq, refitMask);
        boolean[] finalMask = bestMask;
        if (refitCount >= bestCount) {
            finalMask = refitMask;
            Transform second = fit(select(correspondences, refitMask), family);
            if (second != null) refit = second;
        }

        validate(refit, bestCount, params);
        double rms = rmsResidual(refit, correspondences, finalMask);
        return new TransformEstimate(refit, finalMask, trial, rms);
    }

    /**
     * Trials needed so that an all-inlier sample has been drawn with the given confidence.
     */
    static int requiredTrials(double inlierRatio, int sampleSize, double confidence, int trialsSoFar) {
        if (inlierRatio >= 1.0) return trialsSoFar;
        double pGood = Math.pow(inlierRatio, sampleSize);
        if (pGood <= 0) return Integer.MAX_VALUE;
        double needed = Math.log(1 - confidence) / Math.log(1 - pGood);
        if (!Double.isFinite(needed) || needed > Integer.MAX_VALUE) return Integer.MAX_VALUE;
        return Math.max(trialsSoFar, (int) Math.ceil(needed));
    }

    // partial Fisher-Yates: the first k entries become a uniform random sample
    private void drawSample(int[] indices, int k) {
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(indices.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
    }

    private static int score(Transform model, List<Correspondence> correspondences, double maxResidualSq,
                             boolean[] mask) {
        int count = 0;
        for (int i = 0; i < correspondences.size(); i++) {
            if (residualSq(model, correspondences.get(i)) <= maxResidualSq) {
                mask[i] = true;
                count++;
            }
        }
        return count;
    }

    private static double residualSq(Transform model, Correspondence c) {
        double[] p = model.apply(c.getXB(), c.getYB());
        double dx = p[0] - c.getXA(), dy = p[1] - c.getYA();
        return dx * dx + dy * dy;
    }

    private static double rmsResidual(Transform model, List<Correspondence> correspondences, boolean[] mask) {
        double sum = 0;
        int count = 0;
        for (int i = 0; i < correspondences.size(); i++) {
            if (!mask[i]) continue;
            sum += residualSq(model, correspondences.get(i));
            count++;
        }
        return count == 0 ? 0.0 : Math.sqrt(sum / count);
    }

    private static List<Correspondence> select(List<Correspondence> correspondences, boolean[] mask) {
        List<Correspondence> out = new ArrayList<>();
        for (int i = 0; i < mask.length; i++) if (mask[i]) out.add(correspondences.get(i));
        return out;
    }

    private static void validate(Transform t, int inliers, RansacParameters params) throws DegenerateModelException {
        double det = t.determinant();
        if (!t.isFinite() || !Double.isFinite(det)) {
            throw new DegenerateModelException(STAGE, inliers, det, "non-finite coefficients");
        }
        if (det <= 0) {
            throw new DegenerateModelException(STAGE, inliers, det, "reflection or collapse");
        }
        if (Math.abs(det - 1.0) > params.getMaxDeterminantDeviation()) {
            throw new DegenerateModelException(STAGE, inliers, det,
                    "scale change beyond " + params.getMaxDeterminantDeviation());
        }
    }

    /**
     * Least-squares fit in normalised coordinates. With exactly the minimal sample size this is
     * the closed-form solution. Returns null for degenerate (collinear or coincident) point sets.
     */
    static Transform fit(List<Correspondence> points, ModelFamily family) {
        if (points.size() < family.getMinimalSampleSize()) return null;
        Transform normB = normalization(points, false);
        Transform normA = normalization(points, true);
        if (normA == null || normB == null) return null;

        int n = points.size();
        double[] xb = new double[n], yb = new double[n], xa = new double[n], ya = new double[n];
        for (int i = 0; i < n; i++) {
            Correspondence c = points.get(i);
            double[] pb = normB.apply(c.getXB(), c.getYB());
            double[] pa = normA.apply(c.getXA(), c.getYA());
            xb[i] = pb[0]; yb[i] = pb[1]; xa[i] = pa[0]; ya[i] = pa[1];
        }

        Transform model;
        if (family == ModelFamily.SIMILARITY) {
            // x' = a x - b y + tx, y' = b x + a y + ty
            double[] rows = new double[2 * n * 4];
            double[] rhs = new double[2 * n];
            for (int i = 0; i < n; i++) {
                int r = 8 * i;
                rows[r] = xb[i];
                rows[r + 1] = -yb[i];
                rows[r + 2] = 1;
                rows[r + 4] = yb[i];
                rows[r + 5] = xb[i];
                rows[r + 7] = 1;
                rhs[2 * i] = xa[i];
                rhs[2 * i + 1] = ya[i];
            }
            double[] p = leastSquares(rows, 2 * n, 4, rhs, 1);
            if (p == null) return null;
            model = Transform.affine(p[0], -p[1], p[2], p[1], p[0], p[3]);
        } else {
            // both output coordinates share the design matrix, solved as two right-hand columns
            double[] rows = new double[n * 3];
            double[] rhs = new double[n * 2];
            for (int i = 0; i < n; i++) {
                rows[3 * i] = xb[i];
                rows[3 * i + 1] = yb[i];
                rows[3 * i + 2] = 1;
                rhs[2 * i] = xa[i];
                rhs[2 * i + 1] = ya[i];
            }
            double[] p = leastSquares(rows, n, 3, rhs, 2);
            if (p == null) return null;
            // p is 3x2 row-major: column 0 maps to x', column 1 to y'
            model = Transform.affine(p[0], p[2], p[4], p[1], p[3], p[5]);
        }
        Transform result = normA.inverse().compose(model).compose(normB);
        return result.isFinite() ? result : null;
    }

    /**
     * Least squares through OpenCV: LU on the normal equations, null when they are singular.
     * Arrays are row-major; the solution has {@code cols x rhsCols} entries.
     */
    private static double[] leastSquares(double[] design, int rows, int cols, double[] rhs, int rhsCols) {
        Mat a = new Mat(rows, cols, CV_64F);
        Mat b = new Mat(rows, rhsCols, CV_64F);
        Mat x = new Mat();
        try {
            new DoublePointer(a.data()).put(design);
            new DoublePointer(b.data()).put(rhs);
            if (!solve(a, b, x, DECOMP_LU | DECOMP_NORMAL)) return null;
            double[] solution = new double[cols * rhsCols];
            new DoublePointer(x.data()).get(solution);
            return solution;
        } finally {
            a.release();
            b.release();
            x.release();
        }
    }

    // centroid to origin, mean distance sqrt(2)
    private static Transform normalization(List<Correspondence> points, boolean fixedSide) {
        double cx = 0, cy = 0;
        for (Correspondence c : points) {
            cx += fixedSide ? c.getXA() : c.getXB();
            cy += fixedSide ? c.getYA() : c.getYB();
        }
        cx /= points.size();
        cy /= points.size();
        double meanDist = 0;
        for (Correspondence c : points) {
            double dx = (fixedSide ? c.getXA() : c.getXB()) - cx;
            double dy = (fixedSide ? c.getYA() : c.getYB()) - cy;
            meanDist += Math.sqrt(dx * dx + dy * dy);
        }
        meanDist /= points.size();
        if (meanDist < 1e-9) return null;
        double s = Math.sqrt(2) / meanDist;
        return Transform.affine(s, 0, -s * cx, 0, s, -s * cy);
    }
}
