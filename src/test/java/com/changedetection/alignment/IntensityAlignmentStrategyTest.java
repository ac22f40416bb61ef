package com.changedetection.alignment;

import com.changedetection.TestImages;
import com.changedetection.exception.DegenerateModelException;
import com.changedetection.imageOperator.Image;
import com.changedetection.matchAndTransform.Transform;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class IntensityAlignmentStrategyTest {
    private final IntensityAlignmentStrategy strategy = new IntensityAlignmentStrategy();

    @Test
    public void recoversSmallShift() throws Exception {
        Image fixed = TestImages.scene(128, 128, 41L);
        Image moving = TestImages.shifted(fixed, 2, 1);

        AlignmentEstimate estimate = strategy.estimate(fixed, moving);

        Transform t = estimate.getTransform();
        assertEquals(-2.0, t.getTranslationX(), 0.5);
        assertEquals(-1.0, t.getTranslationY(), 0.5);
        assertTrue(estimate.getScore() >= 0.5);
    }

    @Test(expected = DegenerateModelException.class)
    public void flatImageCannotBeRegistered() throws Exception {
        strategy.estimate(Image.constant(32, 32, 1, 50f), TestImages.scene(32, 32, 1L));
    }
}
