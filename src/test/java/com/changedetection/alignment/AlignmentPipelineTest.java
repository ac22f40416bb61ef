package com.changedetection.alignment;

import com.changedetection.TestImages;
import com.changedetection.feature.FeatureMethod;
import com.changedetection.imageOperator.Image;
import com.changedetection.matchAndTransform.Transform;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class AlignmentPipelineTest {
    private final AlignmentPipeline pipeline = AlignmentPipeline.withDefaults(42L);

    @Test
    public void imageAlignedToItselfGivesIdentity() {
        Image scene = TestImages.scene(200, 200, 31L);

        AlignmentResult result = pipeline.align(scene, scene);

        assertTrue(result.isSuccess());
        assertEquals("auto-sift", result.getMethod());
        assertTrue(result.getTransform().toString(), result.getTransform().isIdentity(1e-3));
        assertTrue("inlier ratio " + result.getInlierRatio(), result.getInlierRatio() > 0.9);
        assertEquals(1, result.getAttempts().size());
    }

    @Test
    public void recoversTranslation() {
        Image fixed = TestImages.scene(200, 200, 32L);
        Image moving = TestImages.shifted(fixed, 6, -4);

        AlignmentResult result = pipeline.align(fixed, moving, AlignmentStrategyName.SIFT);

        assertTrue(result.isSuccess());
        assertEquals("sift", result.getMethod());
        Transform t = result.getTransform();
        assertEquals(-6.0, t.getTranslationX(), 0.5);
        assertEquals(4.0, t.getTranslationY(), 0.5);
        assertEquals(0.0, t.getRotationDegrees(), 0.5);
        assertEquals(fixed.getWidth(), result.getAlignedImage().getWidth());
    }

    @Test
    public void blankImagesFallThroughToIdentity() {
        Image blank = Image.constant(64, 64, 1, 0f);

        AlignmentResult result = pipeline.align(blank, blank);

        assertFalse(result.isSuccess());
        assertEquals("none", result.getMethod());
        assertSame(Transform.identity(), result.getTransform());
        assertEquals(4, result.getAttempts().size());
        assertEquals(AlignmentStrategyName.INTENSITY, result.getAttempts().get(3).getStrategy());
        for (AlignmentAttempt attempt : result.getAttempts()) assertFalse(attempt.isSuccess());
    }

    @Test
    public void intensityRegistrationRescuesFailedFeatureMethods() {
        List<AlignmentStrategy> chain = new ArrayList<>();
        for (FeatureMethod method : FeatureMethod.values()) {
            FeatureAlignmentSettings settings = FeatureAlignmentSettings.defaultsFor(method);
            settings.getKeypoints().setMinKeypoints(1_000_000);
            chain.add(new FeatureAlignmentStrategy(method, settings, 42L));
        }
        chain.add(new IntensityAlignmentStrategy());
        Image fixed = TestImages.scene(128, 128, 41L);
        Image moving = TestImages.shifted(fixed, 2, 1);

        AlignmentResult result = new AlignmentPipeline(chain).align(fixed, moving);

        assertTrue(result.isSuccess());
        assertEquals("auto-intensity", result.getMethod());
        assertEquals(4, result.getAttempts().size());
        for (int i = 0; i < 3; i++) assertFalse(result.getAttempts().get(i).isSuccess());
        assertTrue(result.getAttempts().get(3).isSuccess());
        assertEquals(-2.0, result.getTransform().getTranslationX(), 0.5);
        assertEquals(-1.0, result.getTransform().getTranslationY(), 0.5);
    }

    @Test
    public void pinnedStrategyNeverSubstitutesAnother() {
        Image blank = Image.constant(64, 64, 1, 10f);

        AlignmentResult result = pipeline.align(blank, blank, AlignmentStrategyName.ORB);

        assertFalse(result.isSuccess());
        assertEquals("orb", result.getMethod());
        assertEquals(1, result.getAttempts().size());
    }

    @Test
    public void failedAlignmentStillUsesFixedFrame() {
        Image fixed = Image.constant(64, 48, 1, 0f);
        Image moving = Image.constant(80, 40, 1, 7f);

        AlignmentResult result = pipeline.align(fixed, moving);

        assertFalse(result.isSuccess());
        assertEquals(64, result.getAlignedImage().getWidth());
        assertEquals(48, result.getAlignedImage().getHeight());
        assertEquals(7f, result.getAlignedImage().get(10, 10, 0), 0f);
        assertEquals(0f, result.getAlignedImage().get(10, 45, 0), 0f);
    }

    @Test
    public void autoOrderEndsWithIntensity() {
        assertEquals(Arrays.asList(AlignmentStrategyName.SIFT, AlignmentStrategyName.ORB,
                AlignmentStrategyName.HARRIS, AlignmentStrategyName.INTENSITY), pipeline.getAutoOrder());
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateStrategiesAreRejected() {
        new AlignmentPipeline(Arrays.asList(new IntensityAlignmentStrategy(), new IntensityAlignmentStrategy()));
    }
}
