package com.hockeyquant.prediction.multiplier;

import com.hockeyquant.adapter.model.GameLogEntry;
import com.hockeyquant.adapter.model.GameResult;
import com.hockeyquant.adapter.model.NhlSeason;
import com.hockeyquant.adapter.model.TeamSeasonRecord;
import com.hockeyquant.prediction.cache.RunScopedFetchCache;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Recent form over the last ten games measured against the season average.
 * Sub-factors compound and the result is not clamped.
 */
@Component
public class StreakCalculator {

    static final int WINDOW = 10;
    static final int MIN_GAMES = 5;
    static final int STREAK_LENGTH = 5;

    private final RunScopedFetchCache fetchCache;

    public StreakCalculator(RunScopedFetchCache fetchCache) {
        this.fetchCache = fetchCache;
    }

    public Multiplier calculate(String team, TeamSeasonRecord season, LocalDate asOf) {
        List<GameLogEntry> last10 = lastGames(team, asOf);
        if (last10.size() < MIN_GAMES) {
            return Multiplier.neutral("Insufficient data");
        }
        int seasonGames = season.gamesPlayed();
        if (seasonGames == 0) {
            return Multiplier.neutral("No season data");
        }

        int wins = count(last10, GameResult.WIN);
        int losses = count(last10, GameResult.LOSS);
        int otLosses = count(last10, GameResult.OT_LOSS);
        int n = last10.size();

        double recentWinPct = (wins + otLosses * 0.5) / n;
        double recentGf = last10.stream().mapToInt(GameLogEntry::goalsFor).sum() / (double) n;
        double recentGa = last10.stream().mapToInt(GameLogEntry::goalsAgainst).sum() / (double) n;

        double seasonGf = season.goalsFor() / (double) seasonGames;
        double seasonGa = season.goalsAgainst() / (double) seasonGames;

        double formDiff = recentWinPct - season.winPct();
        double mult = 1.0;
        List<String> reasons = new ArrayList<>();

        if (formDiff >= 0.15) {
            mult = 1.05;
            reasons.add("Hot");
        } else if (formDiff >= 0.10) {
            mult = 1.03;
            reasons.add("Warming");
        } else if (formDiff <= -0.15) {
            mult = 0.95;
            reasons.add("Cold");
        } else if (formDiff <= -0.10) {
            mult = 0.97;
            reasons.add("Cooling");
        }

        double gfDiff = recentGf - seasonGf;
        if (gfDiff >= 0.5) {
            mult *= 1.02;
        } else if (gfDiff >= 0.3) {
            mult *= 1.01;
        } else if (gfDiff <= -0.5) {
            mult *= 0.98;
        } else if (gfDiff <= -0.3) {
            mult *= 0.99;
        }

        // Fewer goals against than usual is good
        double gaDiff = recentGa - seasonGa;
        if (gaDiff <= -0.5) {
            mult *= 1.02;
        } else if (gaDiff <= -0.3) {
            mult *= 1.01;
        } else if (gaDiff >= 0.5) {
            mult *= 0.98;
        } else if (gaDiff >= 0.3) {
            mult *= 0.99;
        }

        int consecutiveWins = 0;
        int consecutiveLosses = 0;
        for (GameLogEntry game : last10) {
            if (game.isWin()) {
                if (consecutiveLosses > 0) break;
                consecutiveWins++;
            } else {
                if (consecutiveWins > 0) break;
                consecutiveLosses++;
            }
        }
        if (consecutiveWins >= STREAK_LENGTH) {
            mult *= 1.02;
            reasons.add(consecutiveWins + "W streak");
        } else if (consecutiveLosses >= STREAK_LENGTH) {
            mult *= 0.98;
            reasons.add(consecutiveLosses + "L streak");
        }

        String summary = wins + "-" + losses + "-" + otLosses + " L10"
                + (reasons.isEmpty() ? "" : " (" + String.join(", ", reasons) + ")");
        return new Multiplier(mult, summary);
    }

    /**
     * Up to ten completed games before {@code asOf}, most recent first.
     */
    List<GameLogEntry> lastGames(String team, LocalDate asOf) {
        return fetchCache.getTeamGames(team, NhlSeason.containing(asOf)).stream()
                .filter(g -> g.date().isBefore(asOf))
                .sorted(Comparator.comparing(GameLogEntry::date).reversed())
                .limit(WINDOW)
                .toList();
    }

    private static int count(List<GameLogEntry> games, GameResult result) {
        return (int) games.stream().filter(g -> g.result() == result).count();
    }
}
