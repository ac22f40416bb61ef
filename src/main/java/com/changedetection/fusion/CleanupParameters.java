package com.changedetection.fusion;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class CleanupParameters {
    /** Connected components (8-connected) smaller than this are removed. */
    private int minArea = 50;
    private boolean fillHoles = false;
    /** Disk radius of the closing element; 0 skips the step. */
    private int closingRadius = 2;
    /** Disk radius of the opening element; 0 skips the step. */
    private int openingRadius = 1;

    public CleanupParameters() {
    }

    public CleanupParameters(int minArea, boolean fillHoles, int closingRadius, int openingRadius) {
        this.minArea = minArea;
        this.fillHoles = fillHoles;
        this.closingRadius = closingRadius;
        this.openingRadius = openingRadius;
    }

    void validate() {
        if (minArea < 0) throw new IllegalArgumentException("minArea must be >= 0: " + minArea);
        if (closingRadius < 0) throw new IllegalArgumentException("closingRadius must be >= 0: " + closingRadius);
        if (openingRadius < 0) throw new IllegalArgumentException("openingRadius must be >= 0: " + openingRadius);
    }
}
