package com.changedetection.alignment;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class IntensityParameters {
    private int maxIterations = 300;
    private double epsilon = 1e-5;
    private int gaussFilterSize = 5;
    private double minCorrelation = 0.5;
    private double maxDeterminantDeviation = 0.5;
    // relative to the nominal intensity range
    private double minStdDev = 1e-3;
}
