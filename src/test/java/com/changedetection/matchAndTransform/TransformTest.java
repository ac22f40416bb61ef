package com.changedetection.matchAndTransform;

import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TransformTest {

    @Test
    public void similarityDeterminantIsSquaredScale() {
        Transform t = Transform.similarity(1.5, Math.toRadians(30), 10, -4);
        assertEquals(2.25, t.determinant(), 1e-12);
        assertEquals(30.0, t.getRotationDegrees(), 1e-9);
    }

    @Test
    public void inverseUndoesTransform() {
        Transform t = Transform.affine(1.1, 0.2, 5, -0.1, 0.9, -7);
        assertTrue(t.compose(t.inverse()).isIdentity(1e-12));
        double[] p = t.apply(12, 34);
        assertArrayEquals(new double[]{12, 34}, t.inverse().apply(p[0], p[1]), 1e-9);
    }

    @Test
    public void composeAppliesRightOperandFirst() {
        Transform scale = Transform.affine(2, 0, 0, 0, 2, 0);
        Transform shift = Transform.translation(3, 1);
        assertArrayEquals(new double[]{8, 2}, scale.compose(shift).apply(1, 0), 1e-12);
        assertArrayEquals(new double[]{5, 1}, shift.compose(scale).apply(1, 0), 1e-12);
    }

    @Test
    public void matRoundTripKeepsCoefficients() {
        Transform t = Transform.affine(0.98, -0.05, 12.5, 0.04, 1.01, -3.25);
        assertEquals(t, Transform.fromMat(t.toMat()));
    }

    @Test(expected = IllegalStateException.class)
    public void singularTransformHasNoInverse() {
        Transform.affine(1, 2, 0, 2, 4, 0).inverse();
    }

    @Test
    public void identityChecks() {
        assertTrue(Transform.identity().isIdentity(0));
        assertFalse(Transform.translation(0.1, 0).isIdentity(0.01));
        assertTrue(Transform.translation(0.001, 0).isIdentity(0.01));
    }
}
