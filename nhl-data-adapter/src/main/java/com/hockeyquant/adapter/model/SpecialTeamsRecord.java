package com.hockeyquant.adapter.model;

/**
 * Power-play and penalty-kill rates for a club.
 *
 * <p>Opportunities come from the all-situations row: penalties drawn by the team
 * ({@code penaltiesAgainst}) are its power plays, penalties it takes
 * ({@code penaltiesFor}) are its kills. Rates fall back to league-average values
 * when the denominator is zero.
 */
public record SpecialTeamsRecord(
        String team,
        double powerPlayPct,
        double penaltyKillPct,
        double penaltyKillsPerGame
) {
    public static final double DEFAULT_PP_PCT = 0.20;
    public static final double DEFAULT_PK_PCT = 0.80;
    public static final double DEFAULT_PK_PER_GAME = 3.0;

    public static SpecialTeamsRecord from(TeamStatLine all, TeamStatLine powerPlay, TeamStatLine penaltyKill) {
        double powerPlays = all.penaltiesAgainst();
        double kills = all.penaltiesFor();
        double games = all.gamesPlayed();

        double ppPct = powerPlays > 0 ? powerPlay.goalsFor() / powerPlays : DEFAULT_PP_PCT;
        double pkPct = kills > 0 ? 1 - penaltyKill.goalsAgainst() / kills : DEFAULT_PK_PCT;
        double pkPerGame = games > 0 ? kills / games : DEFAULT_PK_PER_GAME;
        return new SpecialTeamsRecord(all.team(), ppPct, pkPct, pkPerGame);
    }
}
