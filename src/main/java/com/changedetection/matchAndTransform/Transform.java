package com.changedetection.matchAndTransform;

import org.bytedeco.javacpp.DoublePointer;
import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.opencv.opencv_core.Mat;

import java.util.Arrays;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_core.CV_64F;

/**
 * 2D affine mapping stored as a row-major 3x3 matrix on homogeneous coordinates.
 * Maps moving-image pixel coordinates into the fixed image frame.
 */
public final class Transform {
    private static final Transform IDENTITY = new Transform(new double[]{1, 0, 0, 0, 1, 0, 0, 0, 1});

    private final double[] m;

    private Transform(double[] m) {
        this.m = m;
    }

    public static Transform identity() {
        return IDENTITY;
    }

    /**
     * [a b tx; c d ty; 0 0 1]
     */
    public static Transform affine(double a, double b, double tx, double c, double d, double ty) {
        return new Transform(new double[]{a, b, tx, c, d, ty, 0, 0, 1});
    }

    public static Transform similarity(double scale, double rotationRadians, double tx, double ty) {
        double cos = scale * Math.cos(rotationRadians), sin = scale * Math.sin(rotationRadians);
        return affine(cos, -sin, tx, sin, cos, ty);
    }

    public static Transform translation(double tx, double ty) {
        return affine(1, 0, tx, 0, 1, ty);
    }

    public static Transform fromMatrix(double[][] rows) {
        if (rows.length < 2 || rows[0].length != 3 || rows[1].length != 3) {
            throw new IllegalArgumentException("Expected a 2x3 or 3x3 matrix");
        }
        return affine(rows[0][0], rows[0][1], rows[0][2], rows[1][0], rows[1][1], rows[1][2]);
    }

    /**
     * Reads a 2x3 (or 3x3) CV_32F or CV_64F matrix, as produced by OpenCV registration.
     */
    public static Transform fromMat(Mat mat) {
        double[] v = new double[6];
        if (mat.type() == CV_32F) {
            float[] buf = new float[6];
            new FloatPointer(mat.data()).get(buf);
            for (int i = 0; i < 6; i++) v[i] = buf[i];
        } else if (mat.type() == CV_64F) {
            new DoublePointer(mat.data()).get(v);
        } else {
            throw new IllegalArgumentException("Unsupported matrix type " + mat.type());
        }
        return affine(v[0], v[1], v[2], v[3], v[4], v[5]);
    }

    /**
     * 2x3 CV_64F matrix for {@code warpAffine}.
     */
    public Mat toMat() {
        Mat mat = new Mat(2, 3, CV_64F);
        new DoublePointer(mat.data()).put(Arrays.copyOf(m, 6));
        return mat;
    }

    public double[] apply(double x, double y) {
        return new double[]{m[0] * x + m[1] * y + m[2], m[3] * x + m[4] * y + m[5]};
    }

    /**
     * Determinant of the linear part: 1 for rigid motion, the area scale otherwise.
     */
    public double determinant() {
        return m[0] * m[4] - m[1] * m[3];
    }

    public Transform inverse() {
        double det = determinant();
        if (Math.abs(det) < 1e-12) {
            throw new IllegalStateException("Transform is not invertible (det=" + det + ")");
        }
        double a = m[4] / det, b = -m[1] / det, c = -m[3] / det, d = m[0] / det;
        double tx = -(a * m[2] + b * m[5]);
        double ty = -(c * m[2] + d * m[5]);
        return affine(a, b, tx, c, d, ty);
    }

    /**
     * this ∘ other: applies {@code other} first.
     */
    public Transform compose(Transform other) {
        double[] o = other.m;
        double[] r = new double[9];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                r[i * 3 + j] = m[i * 3] * o[j] + m[i * 3 + 1] * o[3 + j] + m[i * 3 + 2] * o[6 + j];
            }
        }
        return new Transform(r);
    }

    public double get(int row, int col) {
        return m[row * 3 + col];
    }

    public double[][] toArray() {
        return new double[][]{{m[0], m[1], m[2]}, {m[3], m[4], m[5]}, {m[6], m[7], m[8]}};
    }

    public double getTranslationX() {
        return m[2];
    }

    public double getTranslationY() {
        return m[5];
    }

    public double getRotationDegrees() {
        return Math.toDegrees(Math.atan2(m[3], m[0]));
    }

    public boolean isFinite() {
        for (double v : m) if (!Double.isFinite(v)) return false;
        return true;
    }

    /**
     * Largest absolute element-wise difference to another transform.
     */
    public double distanceTo(Transform other) {
        double max = 0;
        for (int i = 0; i < 9; i++) max = Math.max(max, Math.abs(m[i] - other.m[i]));
        return max;
    }

    public boolean isIdentity(double epsilon) {
        return distanceTo(IDENTITY) <= epsilon;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Transform && Arrays.equals(m, ((Transform) o).m);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(m);
    }

    @Override
    public String toString() {
        return String.format("[%.4f %.4f %.2f; %.4f %.4f %.2f]", m[0], m[1], m[2], m[3], m[4], m[5]);
    }
}
