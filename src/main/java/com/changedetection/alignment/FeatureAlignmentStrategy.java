package com.changedetection.alignment;

import com.changedetection.exception.AlignmentException;
import com.changedetection.feature.FeatureMethod;
import com.changedetection.feature.FeatureSet;
import com.changedetection.feature.KeypointEngine;
import com.changedetection.imageOperator.Image;
import com.changedetection.matchAndTransform.Correspondence;
import com.changedetection.matchAndTransform.MatchEngine;
import com.changedetection.matchAndTransform.RobustTransformEstimator;
import com.changedetection.matchAndTransform.TransformEstimate;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Keypoints, descriptor matching and random consensus for one feature method.
 */
@Slf4j
public class FeatureAlignmentStrategy implements AlignmentStrategy {
    private final FeatureMethod method;
    private final FeatureAlignmentSettings settings;
    private final long seed;
    private final KeypointEngine keypointEngine = new KeypointEngine();
    private final MatchEngine matchEngine = new MatchEngine();

    public FeatureAlignmentStrategy(FeatureMethod method, FeatureAlignmentSettings settings, long seed) {
        this.method = method;
        this.settings = settings;
        this.seed = seed;
    }

    public FeatureAlignmentStrategy(FeatureMethod method, long seed) {
        this(method, FeatureAlignmentSettings.defaultsFor(method), seed);
    }

    @Override
    public AlignmentStrategyName getName() {
        return AlignmentStrategyName.valueOf(method.name());
    }

    @Override
    public AlignmentEstimate estimate(Image fixed, Image moving) throws AlignmentException {
        FeatureSet featuresFixed = keypointEngine.detectAndDescribe(fixed, method, settings.getKeypoints());
        FeatureSet featuresMoving = keypointEngine.detectAndDescribe(moving, method, settings.getKeypoints());

        List<Correspondence> matches = matchEngine.match(featuresFixed, featuresMoving, settings.getMatching());

        // fresh generator per call keeps repeated alignments of the same pair identical
        RobustTransformEstimator estimator = new RobustTransformEstimator(seed);
        TransformEstimate estimate = estimator.estimate(matches, settings.getRansac());

        log.debug("{}: keypoints {}/{}, matches {}, inliers {}, rms {}", method, featuresFixed.size(),
                featuresMoving.size(), matches.size(), estimate.getInlierCount(), estimate.getRmsResidual());
        return new AlignmentEstimate(estimate.getTransform(), featuresFixed.size(), featuresMoving.size(),
                matches.size(), estimate.getInlierCount(), estimate.getRmsResidual(), estimate.getInlierRatio());
    }
}
