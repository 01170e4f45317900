package com.hockeyquant.prediction.multiplier;

import java.time.LocalDate;

/**
 * A past meeting seen from the analyzed team's side.
 */
public record HeadToHeadEntry(LocalDate date, int goalsFor, int goalsAgainst) {

    public boolean won() {
        return goalsFor > goalsAgainst;
    }

    public int goalDiff() {
        return goalsFor - goalsAgainst;
    }
}
