package com.changedetection.alignment;

import com.changedetection.feature.FeatureMethod;
import com.changedetection.feature.KeypointParameters;
import com.changedetection.matchAndTransform.MatchParameters;
import com.changedetection.matchAndTransform.ModelFamily;
import com.changedetection.matchAndTransform.RansacParameters;
import lombok.Getter;
import lombok.Setter;

/**
 * Detector, matcher and estimator settings for one feature method.
 */
@Getter
@Setter
public class FeatureAlignmentSettings {
    private KeypointParameters keypoints = new KeypointParameters();
    private MatchParameters matching = new MatchParameters();
    private RansacParameters ransac = new RansacParameters();

    /**
     * Field-tested defaults. Blob and binary features fit a full affine model;
     * Harris corners carry weaker descriptors and fit the 4 DOF similarity model.
     */
    public static FeatureAlignmentSettings defaultsFor(FeatureMethod method) {
        FeatureAlignmentSettings settings = new FeatureAlignmentSettings();
        switch (method) {
            case SIFT:
                settings.matching = new MatchParameters(0.7, true, 4);
                settings.ransac = new RansacParameters(ModelFamily.AFFINE, 3000, 3.0, 0.999);
                break;
            case ORB:
                settings.matching = new MatchParameters(0.8, true, 4);
                settings.ransac = new RansacParameters(ModelFamily.AFFINE, 3000, 5.0, 0.99);
                break;
            case HARRIS:
                settings.matching = new MatchParameters(0.6, true, 4);
                settings.ransac = new RansacParameters(ModelFamily.SIMILARITY, 2000, 10.0, 0.99);
                break;
            default:
                throw new IllegalArgumentException("Unknown feature method " + method);
        }
        return settings;
    }
}
