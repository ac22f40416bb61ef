package com.changedetection.changeSignal;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class SignalParameters {
    // pixel difference, 0 disables smoothing
    private double differenceSigma = 0.0;

    // structural similarity
    private int ssimWindow = 11;
    private double ssimSigma = 1.5;
    private double ssimK1 = 0.01;
    private double ssimK2 = 0.03;

    // edge change, thresholds on the 8-bit gray scale
    private double cannyLow = 50.0;
    private double cannyHigh = 150.0;
    private int edgeDilationRadius = 3;

    // texture change
    private int textureWindow = 7;
}
