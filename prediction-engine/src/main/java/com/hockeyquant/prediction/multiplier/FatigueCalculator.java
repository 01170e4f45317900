package com.hockeyquant.prediction.multiplier;

import com.hockeyquant.adapter.model.GameLogEntry;
import com.hockeyquant.adapter.model.NhlSeason;
import com.hockeyquant.adapter.model.NhlTeam;
import com.hockeyquant.prediction.cache.RunScopedFetchCache;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rest, travel pattern and time-zone penalties from the last week of games.
 * Factors compound and are not clamped.
 */
@Component
public class FatigueCalculator {

    static final int LOOKBACK_DAYS = 7;

    private final RunScopedFetchCache fetchCache;

    public FatigueCalculator(RunScopedFetchCache fetchCache) {
        this.fetchCache = fetchCache;
    }

    public Multiplier calculate(String team, String opponent, boolean isAway, LocalDate asOf) {
        List<RecentGame> recent = recentGames(team, asOf);
        if (recent.isEmpty()) {
            return Multiplier.neutral("No recent data");
        }

        RecentGame last = recent.get(0);
        double mult = 1.0;
        List<String> reasons = new ArrayList<>();

        if (last.daysAgo() == 1) {
            mult *= 0.96;
            reasons.add("B2B (-4%)");
            if (last.game().isAway() && isAway) {
                mult *= 0.98;
                reasons.add("Away B2B (-2%)");
            }
        } else if (last.daysAgo() == 2) {
            mult *= 0.98;
            reasons.add("1 day rest (-2%)");
        } else if (last.daysAgo() >= 4) {
            mult *= 1.01;
            reasons.add("Well rested (+1%)");
        }

        long awayCount = recent.stream().filter(g -> g.game().isAway()).count();
        long homeCount = recent.size() - awayCount;

        if (recent.size() >= 3) {
            int alternations = 0;
            for (int i = 0; i < recent.size() - 1; i++) {
                if (recent.get(i).game().venue() != recent.get(i + 1).game().venue()) {
                    alternations++;
                }
            }
            if (alternations >= 2 && awayCount >= 2) {
                mult *= 0.97;
                reasons.add("Choppy travel");
            } else if (awayCount >= 3 && alternations <= 1) {
                mult *= 0.98;
                reasons.add("Road trip");
            } else if (awayCount == 2 && homeCount >= 1) {
                mult *= 0.99;
                reasons.add("Mixed schedule");
            }
        }

        if (homeCount >= 3 && awayCount == 0) {
            mult *= 1.02;
            reasons.add("Homestand (+2%)");
        }

        if (isAway) {
            // Where the team is travelling from: the last opponent's city after a road game
            int fromOffset = last.game().isAway()
                    ? NhlTeam.utcOffsetOf(last.game().opponent())
                    : NhlTeam.utcOffsetOf(team);
            int toOffset = NhlTeam.utcOffsetOf(opponent);
            if (Math.abs(toOffset - fromOffset) >= 3) {
                mult *= 0.97;
                reasons.add("Cross-country");
            }
        }

        String summary = reasons.isEmpty() ? last.daysAgo() + " days rest" : String.join(", ", reasons);
        return new Multiplier(mult, summary);
    }

    /**
     * Completed games 1 to 7 days before {@code asOf}, most recent first.
     */
    List<RecentGame> recentGames(String team, LocalDate asOf) {
        return fetchCache.getTeamGames(team, NhlSeason.containing(asOf)).stream()
                .map(g -> new RecentGame(g, ChronoUnit.DAYS.between(g.date(), asOf)))
                .filter(g -> g.daysAgo() >= 1 && g.daysAgo() <= LOOKBACK_DAYS)
                .sorted(Comparator.comparingLong(RecentGame::daysAgo))
                .toList();
    }

    record RecentGame(GameLogEntry game, long daysAgo) {
    }
}
