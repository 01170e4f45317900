package com.hockeyquant.adapter.model;

import java.time.LocalDate;

/**
 * One completed game from a club's point of view.
 */
public record GameLogEntry(
        LocalDate date,
        String opponent,
        Venue venue,
        GameResult result,
        int goalsFor,
        int goalsAgainst
) {
    public boolean isAway() {
        return venue == Venue.AWAY;
    }

    public boolean isWin() {
        return result == GameResult.WIN;
    }

    public int goalDiff() {
        return goalsFor - goalsAgainst;
    }

    /**
     * A team that did not outscore its opponent loses in OT only if the game went past the
     * third period.
     */
    public static GameResult resultOf(int goalsFor, int goalsAgainst, int lastPeriod) {
        if (goalsFor > goalsAgainst) {
            return GameResult.WIN;
        }
        return lastPeriod > 3 ? GameResult.OT_LOSS : GameResult.LOSS;
    }
}
