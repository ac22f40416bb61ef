package com.changedetection.preprocessing;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class PreprocessParameters {
    // CLAHE
    private double clipLimit = 2.0;
    private int tileGridSize = 8;

    // contrast stretch limits, in percent
    private double stretchLow = 1.0;
    private double stretchHigh = 99.0;

    // odd median kernel size
    private int filterSize = 3;

    // Laplacian MAD estimate above which AUTO denoises
    private double noiseThreshold = 10.0;

    // 1-based band indices for the multispectral composite (NIR, red, green)
    private int[] bandCombination = {4, 3, 2};

    void validate() {
        if (!(clipLimit > 0)) throw new IllegalArgumentException("clipLimit must be positive: " + clipLimit);
        if (tileGridSize < 1) throw new IllegalArgumentException("tileGridSize must be >= 1: " + tileGridSize);
        if (!(stretchLow >= 0 && stretchLow < stretchHigh && stretchHigh <= 100)) {
            throw new IllegalArgumentException("Invalid stretch limits " + stretchLow + ".." + stretchHigh);
        }
        if (filterSize < 3 || filterSize % 2 == 0) {
            throw new IllegalArgumentException("filterSize must be odd and >= 3: " + filterSize);
        }
        if (bandCombination == null || bandCombination.length != 3) {
            throw new IllegalArgumentException("bandCombination must name three bands");
        }
    }
}
