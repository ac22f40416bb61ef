package com.changedetection.matchAndTransform;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class MatchParameters {
    private double maxRatio = 0.7;
    private boolean unique = true;
    // four correspondences is the least an affine solve with one check point needs
    private int minMatches = 4;

    public MatchParameters() {
    }

    public MatchParameters(double maxRatio, boolean unique, int minMatches) {
        this.maxRatio = maxRatio;
        this.unique = unique;
        this.minMatches = minMatches;
    }
}
