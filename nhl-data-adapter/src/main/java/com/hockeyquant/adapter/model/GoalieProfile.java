package com.hockeyquant.adapter.model;

/**
 * Season line for a goalie. Rates are always derived from raw counts through
 * {@link #fromCounts} so every goalie is normalized the same way.
 */
public record GoalieProfile(
        String name,
        String team,
        int gamesPlayed,
        double savePct,
        double goalsAgainstAverage,
        double goalsSavedAboveExpected
) {
    public static final double DEFAULT_SAVE_PCT = 0.900;
    public static final double DEFAULT_GAA = 3.0;

    public static GoalieProfile fromCounts(String name, String team, int gamesPlayed,
                                           double expectedGoals, double goals,
                                           double shotsOnGoal, double icetimeSeconds) {
        double gsax = expectedGoals - goals;
        double svPct = shotsOnGoal > 0 ? (shotsOnGoal - goals) / shotsOnGoal : DEFAULT_SAVE_PCT;
        double gaa = icetimeSeconds > 0 ? goals * 3600.0 / icetimeSeconds : DEFAULT_GAA;
        return new GoalieProfile(name, team, gamesPlayed, svPct, gaa, gsax);
    }
}
