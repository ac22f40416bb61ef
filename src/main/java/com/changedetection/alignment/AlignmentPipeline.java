package com.changedetection.alignment;

import com.changedetection.exception.AlignmentException;
import com.changedetection.feature.FeatureMethod;
import com.changedetection.imageOperator.Image;
import com.changedetection.matchAndTransform.Transform;
import com.changedetection.warper.ImageWarper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aligns a moving image onto a fixed one by walking an ordered list of strategies.
 * The first strategy that produces a valid transform wins; when all of them fail the
 * identity transform is returned with {@code success=false}. Strategy failures never
 * escape this class.
 */
@Slf4j
public class AlignmentPipeline {
    private final Map<AlignmentStrategyName, AlignmentStrategy> strategies = new EnumMap<>(AlignmentStrategyName.class);
    private final List<AlignmentStrategyName> autoOrder = new ArrayList<>();
    private final ImageWarper warper = new ImageWarper();

    /**
     * @param chain strategies in the order AUTO tries them
     */
    public AlignmentPipeline(List<? extends AlignmentStrategy> chain) {
        for (AlignmentStrategy strategy : chain) {
            if (strategy.getName() == AlignmentStrategyName.AUTO) {
                throw new IllegalArgumentException("AUTO is not a concrete strategy");
            }
            if (strategies.put(strategy.getName(), strategy) != null) {
                throw new IllegalArgumentException("Duplicate strategy " + strategy.getName());
            }
            autoOrder.add(strategy.getName());
        }
    }

    /**
     * SIFT, ORB and Harris with their default settings, then intensity registration.
     */
    public static AlignmentPipeline withDefaults(long seed) {
        return new AlignmentPipeline(Arrays.asList(
                new FeatureAlignmentStrategy(FeatureMethod.SIFT, seed),
                new FeatureAlignmentStrategy(FeatureMethod.ORB, seed),
                new FeatureAlignmentStrategy(FeatureMethod.HARRIS, seed),
                new IntensityAlignmentStrategy()));
    }

    public List<AlignmentStrategyName> getAutoOrder() {
        return Collections.unmodifiableList(autoOrder);
    }

    public AlignmentResult align(Image fixed, Image moving) {
        return align(fixed, moving, AlignmentStrategyName.AUTO);
    }

    /**
     * @param strategyName AUTO walks the whole chain; a named strategy is tried alone and
     *                     falls back to identity on failure, never to another method
     */
    public AlignmentResult align(Image fixed, Image moving, AlignmentStrategyName strategyName) {
        List<AlignmentStrategyName> order;
        if (strategyName == AlignmentStrategyName.AUTO) {
            order = autoOrder;
        } else if (strategies.containsKey(strategyName)) {
            order = Collections.singletonList(strategyName);
        } else {
            throw new IllegalArgumentException("Strategy " + strategyName + " is not configured");
        }

        AlignmentResult.AlignmentResultBuilder result = AlignmentResult.builder();
        for (AlignmentStrategyName name : order) {
            log.info("Trying {} alignment", name);
            try {
                AlignmentEstimate estimate = strategies.get(name).estimate(fixed, moving);
                Image aligned = warper.warp(moving, estimate.getTransform(), fixed.getWidth(), fixed.getHeight());
                String method = strategyName == AlignmentStrategyName.AUTO
                        ? "auto-" + name.name().toLowerCase() : name.name().toLowerCase();
                log.info("Aligned using {} ({} inliers of {} matches)", name, estimate.getInliers(),
                        estimate.getMatches());
                return result.attempt(new AlignmentAttempt(name, true, "ok"))
                        .transform(estimate.getTransform())
                        .alignedImage(aligned)
                        .method(method)
                        .success(true)
                        .keypointsFixed(estimate.getKeypointsFixed())
                        .keypointsMoving(estimate.getKeypointsMoving())
                        .matches(estimate.getMatches())
                        .inliers(estimate.getInliers())
                        .rmsResidual(estimate.getRmsResidual())
                        .score(estimate.getScore())
                        .build();
            } catch (AlignmentException e) {
                log.info("{} alignment failed at {}: {}", name, e.getStage(), e.getMessage());
                result.attempt(new AlignmentAttempt(name, false, e.getMessage()));
            } catch (RuntimeException e) {
                // native OpenCV errors surface as RuntimeException
                log.warn("{} alignment raised an unexpected error", name, e);
                result.attempt(new AlignmentAttempt(name, false, e.toString()));
            }
        }

        log.warn("All alignment methods failed ({}), returning the unaligned image", order);
        return result.transform(Transform.identity())
                .alignedImage(warper.fitToFrame(moving, fixed.getWidth(), fixed.getHeight()))
                .method(strategyName == AlignmentStrategyName.AUTO ? "none" : strategyName.name().toLowerCase())
                .success(false)
                .rmsResidual(Double.NaN)
                .score(0.0)
                .build();
    }
}
