package com.hockeyquant.prediction.model;

/**
 * How far apart the two final scores are.
 */
public enum ConfidenceTier {
    STRONG,
    MODERATE,
    CLOSE;

    public static ConfidenceTier forDiff(double diff) {
        if (diff >= 10) {
            return STRONG;
        }
        if (diff >= 5) {
            return MODERATE;
        }
        return CLOSE;
    }
}
