package com.hockeyquant.prediction.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A picked game: both sides' analyses, the favoured team and why.
 */
public record GamePrediction(
        TeamAnalysis away,
        TeamAnalysis home,
        String pick,
        double scoreDiff,
        ConfidenceTier tier,
        List<String> keyFactors
) {
    static final int MAX_KEY_FACTORS = 3;

    public GamePrediction {
        keyFactors = List.copyOf(keyFactors);
    }

    /**
     * Home is picked only when it scores strictly higher; a dead heat goes to the away side.
     */
    public static GamePrediction of(TeamAnalysis away, TeamAnalysis home) {
        double diff = home.finalScore() - away.finalScore();
        boolean homePick = diff > 0;
        TeamAnalysis winner = homePick ? home : away;
        TeamAnalysis loser = homePick ? away : home;
        double absDiff = Math.abs(diff);
        return new GamePrediction(away, home, winner.team(), absDiff,
                ConfidenceTier.forDiff(absDiff), keyFactors(winner, loser));
    }

    static List<String> keyFactors(TeamAnalysis winner, TeamAnalysis loser) {
        List<String> factors = new ArrayList<>();
        if (winner.streak().factor() > 1.02) {
            factors.add(winner.team() + " hot");
        }
        if (loser.streak().factor() < 0.95) {
            factors.add(loser.team() + " cold");
        }
        if (winner.injury().factor() > loser.injury().factor() + 0.02) {
            factors.add(loser.team() + " injuries");
        }
        if (loser.fatigue().factor() < 0.95) {
            factors.add(loser.team() + " fatigued");
        }
        if (winner.headToHead().factor() > 1.02) {
            factors.add(winner.team() + " H2H edge");
        }
        return factors.size() > MAX_KEY_FACTORS ? factors.subList(0, MAX_KEY_FACTORS) : factors;
    }

    public boolean isHomePick() {
        return pick.equals(home.team());
    }

    public String gameId(LocalDate date) {
        return date + "_" + away.team() + "_" + home.team();
    }

    public PredictionRecord toRecord(LocalDate date) {
        return new PredictionRecord(
                gameId(date),
                date,
                away.team(),
                home.team(),
                away.baseScore(),
                away.finalScore(),
                home.baseScore(),
                home.finalScore(),
                away.starterName(),
                home.starterName(),
                away.fatigue().factor(), away.fatigue().summary(),
                home.fatigue().factor(), home.fatigue().summary(),
                away.streak().factor(), away.streak().summary(),
                home.streak().factor(), home.streak().summary(),
                away.specialTeams().factor(), away.specialTeams().summary(),
                home.specialTeams().factor(), home.specialTeams().summary(),
                away.injury().factor(), away.injury().summary(),
                home.injury().factor(), home.injury().summary(),
                away.headToHead().factor(), away.headToHead().summary(),
                home.headToHead().factor(), home.headToHead().summary(),
                pick,
                BigDecimal.valueOf(scoreDiff).setScale(2, RoundingMode.HALF_UP).doubleValue(),
                tier,
                keyFactors);
    }
}
