package com.hockeyquant.adapter.model;

/**
 * One row of the team season table for a single situation.
 */
public record TeamStatLine(
        String team,
        Situation situation,
        int gamesPlayed,
        double expectedGoalsFor,
        double expectedGoalsAgainst,
        double goalsFor,
        double goalsAgainst,
        double penaltiesFor,
        double penaltiesAgainst
) {
}
