package com.hockeyquant.adapter.model;

/**
 * Final score of a completed game. {@code winner} is null on a tie.
 */
public record FinalScore(
        String gameId,
        String away,
        String home,
        int awayGoals,
        int homeGoals
) {
    public String winner() {
        if (awayGoals > homeGoals) {
            return away;
        }
        if (homeGoals > awayGoals) {
            return home;
        }
        return null;
    }
}
