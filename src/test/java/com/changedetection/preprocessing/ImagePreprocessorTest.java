package com.changedetection.preprocessing;

import com.changedetection.TestImages;
import com.changedetection.imageOperator.Image;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ImagePreprocessorTest {
    private final ImagePreprocessor preprocessor = new ImagePreprocessor();
    private final PreprocessParameters params = new PreprocessParameters();

    @Test
    public void normalizeSpansEightBitRange() {
        float[] data = new float[100];
        for (int i = 0; i < data.length; i++) data[i] = 1000 + 10 * i;
        Image image = Image.of(10, 10, 65535.0, data);

        Image out = preprocessor.preprocess(image, PreprocessMethod.NORMALIZE, params);

        assertEquals(255.0, out.getMaxValue(), 0.0);
        assertEquals(0f, out.get(0, 0, 0), 1e-4f);
        assertEquals(255f, out.get(9, 9, 0), 1e-4f);
    }

    @Test
    public void denoiseRemovesIsolatedSpike() {
        Image image = TestImages.withBlock(Image.constant(20, 20, 1, 100f), 10, 10, 1, 150f);

        Image out = preprocessor.preprocess(image, PreprocessMethod.DENOISE, params);

        assertEquals(100f, out.get(10, 10, 0), 0f);
    }

    @Test
    public void enhanceStretchesToFullRange() {
        float[] data = new float[1000];
        for (int i = 0; i < data.length; i++) data[i] = 100 + (i % 50);
        Image out = preprocessor.preprocess(Image.gray(100, 10, data), PreprocessMethod.ENHANCE, params);

        float min = Float.MAX_VALUE, max = -Float.MAX_VALUE;
        for (float v : out.band(0)) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        assertEquals(0f, min, 0f);
        assertEquals(255f, max, 0f);
    }

    @Test
    public void multispectralBuildsFalseColourComposite() {
        float[][] bands = new float[5][];
        for (int b = 0; b < 5; b++) {
            bands[b] = new float[16];
            for (int i = 0; i < 16; i++) bands[b][i] = (b + 1) * i;
        }
        Image image = Image.of(4, 4, 255.0, bands);

        Image out = preprocessor.preprocess(image, PreprocessMethod.MULTISPECTRAL, params);

        assertEquals(3, out.getBandCount());
        assertEquals(4, out.getWidth());
    }

    @Test
    public void autoKeepsShapeOfGrayAndColourImages() {
        Image gray = TestImages.scene(64, 48, 51L);
        Image colour = TestImages.colorScene(64, 48, 52L);

        Image grayOut = preprocessor.preprocess(gray);
        Image colourOut = preprocessor.preprocess(colour);

        assertEquals(gray.describeShape(), grayOut.describeShape());
        assertEquals(colour.describeShape(), colourOut.describeShape());
    }

    @Test
    public void noiseEstimate() {
        assertEquals(0.0, ImagePreprocessor.noiseEstimate(Image.constant(16, 16, 1, 80f)), 1e-9);

        java.util.Random random = new java.util.Random(3);
        float[] noisy = new float[64 * 64];
        for (int i = 0; i < noisy.length; i++) noisy[i] = (float) (128 + 40 * random.nextGaussian());
        assertTrue(ImagePreprocessor.noiseEstimate(Image.gray(64, 64, noisy)) > 10);
    }

    @Test(expected = IllegalArgumentException.class)
    public void evenFilterSizeIsRejected() {
        PreprocessParameters even = new PreprocessParameters();
        even.setFilterSize(4);
        preprocessor.preprocess(Image.constant(8, 8, 1, 0f), PreprocessMethod.DENOISE, even);
    }
}
