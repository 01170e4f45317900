package com.hockeyquant.prediction.model;

import com.hockeyquant.adapter.model.GoalieProfile;
import com.hockeyquant.prediction.multiplier.Multiplier;

/**
 * One side of a matchup: the season-quality base score, the five situational
 * multipliers and the final score they produce. Never modified after construction;
 * a goalie change produces a new instance.
 *
 * @param starter chosen starting goalie, null when the team has no goalie data
 * @param backup  second goalie, null when there is none
 */
public record TeamAnalysis(
        String team,
        String opponent,
        boolean away,
        double offensiveQuality,
        double defensiveQuality,
        double goalieScore,
        double baseScore,
        double finalScore,
        GoalieProfile starter,
        GoalieProfile backup,
        Multiplier fatigue,
        Multiplier streak,
        Multiplier specialTeams,
        Multiplier injury,
        Multiplier headToHead
) {
    public String starterName() {
        return starter != null ? starter.name() : "Unknown";
    }

    public String backupName() {
        return backup != null ? backup.name() : null;
    }

    public double combinedMultiplier() {
        return fatigue.factor() * streak.factor() * specialTeams.factor()
                * injury.factor() * headToHead.factor();
    }
}
