package com.hockeyquant.prediction.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;
import java.util.List;

/**
 * Flat, serializable form of a {@link GamePrediction} for downstream consumers.
 */
public record PredictionRecord(
        String gameId,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd") LocalDate gameDate,
        String awayTeam,
        String homeTeam,
        double awayBaseScore,
        double awayFinalScore,
        double homeBaseScore,
        double homeFinalScore,
        String awayGoalie,
        String homeGoalie,
        double awayFatigue,
        String awayFatigueSummary,
        double homeFatigue,
        String homeFatigueSummary,
        double awayStreak,
        String awayStreakSummary,
        double homeStreak,
        String homeStreakSummary,
        double awaySpecialTeams,
        String awaySpecialTeamsSummary,
        double homeSpecialTeams,
        String homeSpecialTeamsSummary,
        double awayInjury,
        String awayInjurySummary,
        double homeInjury,
        String homeInjurySummary,
        double awayHeadToHead,
        String awayHeadToHeadSummary,
        double homeHeadToHead,
        String homeHeadToHeadSummary,
        String predictedWinner,
        double scoreDiff,
        ConfidenceTier confidence,
        List<String> keyFactors
) {
}
