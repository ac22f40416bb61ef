package com.changedetection.changeSignal;

import com.changedetection.TestImages;
import com.changedetection.exception.UnsupportedBandCountException;
import com.changedetection.imageOperator.Image;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ChangeSignalDetectorsTest {
    private final SignalParameters params = new SignalParameters();

    @Test
    public void pixelDifferenceHighlightsBlock() {
        Image before = Image.constant(50, 50, 1, 50f);
        Image after = TestImages.withBlock(before, 10, 10, 20, 50f);

        ChangeSignal signal = new PixelDifferenceSignal().compute(before, after, params);

        assertEquals(SignalType.PIXEL_DIFFERENCE, signal.getType());
        assertEquals(1f, signal.getMap().get(15, 15), 0f);
        assertEquals(0f, signal.getMap().get(40, 40), 0f);
        assertEquals(50.0 * 400 / 2500, signal.getStatistic("meanDifference"), 1e-9);
        assertEquals(400, signal.getStandaloneMask().getChangedPixels());
    }

    @Test
    public void identicalImagesHaveNoStructuralChange() {
        Image scene = TestImages.scene(64, 64, 1L);

        ChangeSignal signal = new StructuralSimilaritySignal().compute(scene, scene, params);

        assertEquals(1.0, signal.getStatistic("overallSsim"), 1e-9);
        assertEquals(0.0, signal.getMap().mean(), 0.0);
        assertEquals(0, signal.getStandaloneMask().getChangedPixels());
    }

    @Test
    public void structuralChangePeaksInsideAlteredRegion() {
        Image scene = TestImages.scene(64, 64, 2L);
        Image after = TestImages.withBlock(scene, 20, 20, 16, 80f);

        ChangeSignal signal = new StructuralSimilaritySignal().compute(scene, after, params);

        assertTrue(signal.getStatistic("overallSsim") < 1.0);
        assertTrue(signal.getMap().get(28, 20) > signal.getMap().get(2, 60));
    }

    @Test
    public void edgeChangeCountsAddedEdges() {
        Image before = Image.constant(60, 60, 1, 50f);
        Image after = TestImages.withBlock(before, 20, 20, 20, 150f);

        ChangeSignal signal = new EdgeChangeSignal().compute(before, after, params);

        assertTrue(signal.getStatistic("edgesAdded") > 0);
        assertEquals(0.0, signal.getStatistic("edgesRemoved"), 0.0);
        assertEquals(1f, signal.getMap().get(20, 30), 0f);
        assertEquals(0f, signal.getMap().get(5, 5), 0f);
        assertEquals(0f, signal.getMap().get(30, 30), 0f);
    }

    @Test
    public void textureChangeFindsNewTexture() {
        Image before = Image.constant(40, 40, 1, 100f);
        float[] data = before.band(0);
        for (int y = 10; y < 30; y++) {
            for (int x = 10; x < 30; x++) data[y * 40 + x] = ((x + y) % 2 == 0) ? 60f : 140f;
        }
        Image after = Image.gray(40, 40, data);

        ChangeSignal signal = new TextureChangeSignal().compute(before, after, params);

        assertEquals(1f, signal.getMap().get(20, 20), 1e-6f);
        assertEquals(0f, signal.getMap().get(0, 0), 1e-6f);
        assertTrue(signal.getStatistic("meanTextureChange") > 0);
    }

    @Test
    public void localStdOfConstantIsZero() {
        double[] plane = new double[25];
        java.util.Arrays.fill(plane, 3.0);
        for (double v : TextureChangeSignal.localStd(plane, 5, 5, 3)) assertEquals(0.0, v, 1e-6);
    }

    @Test
    public void spectralAngleIgnoresBrightnessScaling() {
        Image before = TestImages.colorScene(32, 32, 3L);
        float[][] bands = new float[3][];
        for (int b = 0; b < 3; b++) {
            bands[b] = before.band(b);
            for (int i = 0; i < bands[b].length; i++) bands[b][i] *= 2f;
        }
        Image brighter = Image.of(32, 32, 255.0, bands);

        ChangeSignal signal = new SpectralAngleSignal().compute(before, brighter, params);

        assertEquals(0.0, signal.getStatistic("meanSpectralAngle"), 1e-12);
        assertEquals(3.0, signal.getStatistic("bands"), 0.0);
        assertEquals(0.0, signal.getMap().mean(), 0.0);
    }

    @Test
    public void spectralAngleDetectsColourChange() {
        Image before = Image.constant(20, 20, 3, 100f);
        float[] b = before.band(0), g = before.band(1), r = before.band(2);
        for (int y = 5; y < 10; y++) {
            for (int x = 5; x < 10; x++) r[y * 20 + x] = 200f;
        }
        Image after = Image.of(20, 20, 255.0, b, g, r);

        ChangeSignal signal = new SpectralAngleSignal().compute(before, after, params);

        assertEquals(1f, signal.getMap().get(7, 7), 1e-6f);
        assertEquals(0f, signal.getMap().get(15, 15), 0f);
    }

    @Test
    public void blackPixelsOnBothSidesAreUnchanged() {
        float[][] zero = {{0f}, {0f}, {0f}};
        float[][] lit = {{1f}, {0f}, {0f}};
        assertEquals(0.0, SpectralAngleSignal.angle(zero, zero, 0), 0.0);
        assertEquals(Math.PI / 2, SpectralAngleSignal.angle(zero, lit, 0), 0.0);
    }

    @Test(expected = UnsupportedBandCountException.class)
    public void spectralAngleNeedsMultiBandInput() {
        Image gray = Image.constant(10, 10, 1, 10f);
        new SpectralAngleSignal().compute(gray, gray, params);
    }
}
