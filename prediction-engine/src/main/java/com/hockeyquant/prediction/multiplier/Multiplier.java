package com.hockeyquant.prediction.multiplier;

/**
 * A situational adjustment to a team's base score, with a short explanation.
 */
public record Multiplier(double factor, String summary) {

    public static Multiplier neutral(String summary) {
        return new Multiplier(1.0, summary);
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
