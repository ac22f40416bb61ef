package com.changedetection.fusion;

import com.changedetection.TestImages;
import com.changedetection.changeSignal.SignalType;
import com.changedetection.changeSignal.ThresholdMethod;
import com.changedetection.exception.DimensionMismatchException;
import com.changedetection.imageOperator.Image;
import org.junit.Test;

import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ChangeDetectorTest {
    private final ChangeDetector detector = new ChangeDetector();

    @Test
    public void identicalConstantImagesShowNoChange() {
        Image image = Image.constant(100, 100, 1, 120f);

        DetectionResult result = detector.detect(image, image);

        assertEquals(0, result.getChangedPixels());
        assertEquals(0.0, result.getChangePercentage(), 0.0);
        assertEquals(10000, result.getTotalPixels());
        assertEquals(0.1, result.getThreshold(), 0.0);
        assertTrue(result.getUnavailableSignals().containsKey(SignalType.SPECTRAL_ANGLE));
        assertEquals(4, result.getFusedSignals().size());
    }

    @Test
    public void shiftedBlockIsFoundByPixelDifference() {
        Image before = Image.constant(100, 100, 1, 90f);
        Image after = TestImages.withBlock(before, 30, 30, 40, 72f);
        DetectionParameters params = new DetectionParameters();
        params.setCleanup(new CleanupParameters(50, false, 0, 0));

        DetectionResult result = detector.detect(before, after, DetectionMethod.PIXEL, params);

        assertEquals(1600, result.getChangedPixels(), 80);
        assertEquals(result.getMask().getChangedPixels(), result.getChangedPixels());
        assertEquals(100.0 * result.getChangedPixels() / result.getTotalPixels(), result.getChangePercentage(), 1e-12);
        assertEquals(Collections.singletonList(SignalType.PIXEL_DIFFERENCE), result.getFusedSignals());
    }

    @Test
    public void fusionLocalisesChangedRegion() {
        Image before = TestImages.scene(96, 96, 8L);
        Image after = TestImages.withBlock(before, 40, 40, 24, 90f);

        DetectionResult result = detector.detect(before, after);

        assertTrue(result.getChangedPixels() > 0);
        assertTrue(result.getMask().get(52, 52));
        assertFalse(result.getMask().get(5, 5));
        assertTrue(result.getThreshold() >= 0.1 && result.getThreshold() <= 0.9);
        assertEquals(result.getMask().getChangedPixels(), result.getChangedPixels());
    }

    @Test
    public void spectralMethodFallsBackToPixelDifferenceOnGrayInput() {
        Image before = Image.constant(40, 40, 1, 50f);
        Image after = TestImages.withBlock(before, 10, 10, 20, 60f);

        DetectionResult result = detector.detect(before, after, DetectionMethod.SPECTRAL, new DetectionParameters());

        assertEquals(Collections.singletonList(SignalType.PIXEL_DIFFERENCE), result.getFusedSignals());
        assertTrue(result.getUnavailableSignals().containsKey(SignalType.SPECTRAL_ANGLE));
        assertTrue(result.getChangedPixels() > 300);
    }

    @Test
    public void manualThresholdIsClamped() {
        Image before = Image.constant(30, 30, 1, 10f);
        Image after = TestImages.withBlock(before, 5, 5, 10, 20f);
        DetectionParameters params = new DetectionParameters();
        params.setThreshold(0.0);
        params.setPostProcess(false);

        DetectionResult result = detector.detect(before, after, DetectionMethod.PIXEL, params);

        assertEquals(0.1, result.getThreshold(), 0.0);
        assertEquals(100, result.getChangedPixels());
    }

    @Test
    public void percentilePolicyIsApplied() {
        Image before = TestImages.scene(64, 64, 9L);
        Image after = TestImages.withBlock(before, 10, 10, 20, 50f);
        DetectionParameters params = new DetectionParameters();
        params.setThresholdMethod(ThresholdMethod.PERCENTILE);
        params.setPercentile(50);
        params.setPostProcess(false);

        DetectionResult result = detector.detect(before, after, DetectionMethod.PIXEL, params);

        assertEquals(0.1, result.getThreshold(), 0.0);
    }

    @Test(expected = DimensionMismatchException.class)
    public void differentSizesAreRejected() {
        detector.detect(Image.constant(20, 20, 1, 0f), Image.constant(21, 20, 1, 0f));
    }
}
