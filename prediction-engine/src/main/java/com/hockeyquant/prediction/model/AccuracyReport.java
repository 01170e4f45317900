package com.hockeyquant.prediction.model;

import java.util.Locale;
import java.util.Map;

/**
 * How a set of predictions fared against final scores.
 *
 * @param ungraded predictions with no final score yet, excluded from {@code total}
 */
public record AccuracyReport(
        int total,
        int correct,
        int ungraded,
        double accuracy,
        Map<ConfidenceTier, TierAccuracy> byTier
) {
    public AccuracyReport {
        byTier = Map.copyOf(byTier);
    }

    public String getAccuracyPercent() {
        return String.format(Locale.ROOT, "%.1f%%", accuracy * 100);
    }
}
