package com.hockeyquant.prediction.model;

import java.util.Locale;

public record TierAccuracy(
        ConfidenceTier tier,
        int total,
        int correct,
        double accuracy
) {
    public static TierAccuracy of(ConfidenceTier tier, int total, int correct) {
        return new TierAccuracy(tier, total, correct, total == 0 ? 0.0 : (double) correct / total);
    }

    public String getAccuracyPercent() {
        return String.format(Locale.ROOT, "%.1f%%", accuracy * 100);
    }
}
