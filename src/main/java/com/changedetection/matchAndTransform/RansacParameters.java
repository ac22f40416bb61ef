package com.changedetection.matchAndTransform;

import lombok.Getter;
import lombok.Setter;

/**
 * Random consensus settings. Satellite pairs with repetitive or sparse texture produce noisy
 * correspondence sets; more trials and a relaxed residual trade runtime for convergence.
 */
@Getter
@Setter
public class RansacParameters {
    private ModelFamily modelFamily = ModelFamily.AFFINE;
    private int maxTrials = 2000;
    private double maxResidual = 3.0;
    private double confidence = 0.99;
    private double minInlierFraction = 0.1;
    // |det - 1| above this rejects the model as non-physical
    private double maxDeterminantDeviation = 0.5;

    public RansacParameters() {
    }

    public RansacParameters(ModelFamily modelFamily, int maxTrials, double maxResidual, double confidence) {
        this.modelFamily = modelFamily;
        this.maxTrials = maxTrials;
        this.maxResidual = maxResidual;
        this.confidence = confidence;
    }

    void validate() {
        if (maxTrials <= 0) throw new IllegalArgumentException("maxTrials must be positive: " + maxTrials);
        if (!(maxResidual > 0)) throw new IllegalArgumentException("maxResidual must be positive: " + maxResidual);
        if (!(confidence > 0 && confidence < 1)) {
            throw new IllegalArgumentException("confidence must be in (0,1): " + confidence);
        }
        if (minInlierFraction < 0 || minInlierFraction > 1) {
            throw new IllegalArgumentException("minInlierFraction must be in [0,1]: " + minInlierFraction);
        }
    }
}
