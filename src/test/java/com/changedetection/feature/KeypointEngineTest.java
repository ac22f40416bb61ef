package com.changedetection.feature;

import com.changedetection.TestImages;
import com.changedetection.exception.InsufficientFeaturesException;
import com.changedetection.imageOperator.Image;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class KeypointEngineTest {
    private final KeypointEngine engine = new KeypointEngine();
    private final Image scene = TestImages.scene(200, 200, 21L);

    @Test
    public void siftDescribesEveryKeptKeypoint() throws Exception {
        FeatureSet features = engine.detectAndDescribe(scene, FeatureMethod.SIFT, new KeypointParameters());

        assertTrue(features.size() >= 20);
        assertEquals(features.getKeypoints().size(), features.getDescriptors().size());
        assertFalse(features.getDescriptors().get(0).isBinary());
        assertEquals(128, features.getDescriptors().get(0).length());
    }

    @Test
    public void orbProducesBinaryDescriptors() throws Exception {
        KeypointParameters params = new KeypointParameters();
        params.setMinKeypoints(5);
        FeatureSet features = engine.detectAndDescribe(scene, FeatureMethod.ORB, params);

        assertTrue(features.getDescriptors().get(0).isBinary());
        assertEquals(32, features.getDescriptors().get(0).length());
    }

    @Test
    public void harrisCornersAreSortedAndCapped() throws Exception {
        KeypointParameters params = new KeypointParameters();
        params.setMaxKeypoints(50);
        List<Keypoint> corners = engine.detect(scene, FeatureMethod.HARRIS, params);

        assertTrue(corners.size() <= 50);
        for (int i = 1; i < corners.size(); i++) {
            assertTrue(corners.get(i - 1).getStrength() >= corners.get(i).getStrength());
        }
    }

    @Test(expected = InsufficientFeaturesException.class)
    public void blankImageHasNoFeatures() throws Exception {
        engine.detect(Image.constant(100, 100, 1, 128f), FeatureMethod.SIFT, new KeypointParameters());
    }

    @Test
    public void failureCarriesCounts() {
        try {
            engine.detect(Image.constant(64, 64, 1, 0f), FeatureMethod.ORB, new KeypointParameters());
        } catch (InsufficientFeaturesException e) {
            assertEquals(0, e.getObserved());
            assertEquals(20, e.getRequired());
            return;
        }
        throw new AssertionError("expected InsufficientFeaturesException");
    }
}
