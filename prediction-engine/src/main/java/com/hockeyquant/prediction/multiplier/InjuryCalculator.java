package com.hockeyquant.prediction.multiplier;

import com.hockeyquant.adapter.model.SkaterSeasonLine;
import com.hockeyquant.adapter.provider.InjuryFeed;
import com.hockeyquant.prediction.cache.SeasonStatsCache;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Penalty for injured players, weighted by how much each one contributes.
 * Every 20 importance points cost 1%, floored at 0.90.
 */
@Component
public class InjuryCalculator {

    static final double UNKNOWN_PLAYER_IMPORTANCE = 15.0;
    static final double PENALTY_PER_POINT = 0.0005;
    static final double FLOOR = 0.90;

    private final InjuryFeed injuryFeed;
    private final SeasonStatsCache statsCache;

    public InjuryCalculator(InjuryFeed injuryFeed, SeasonStatsCache statsCache) {
        this.injuryFeed = injuryFeed;
        this.statsCache = statsCache;
    }

    public Multiplier calculate(String team) {
        List<String> injured = injuryFeed.getInjuries(team);
        if (injured.isEmpty()) {
            return Multiplier.neutral("Healthy");
        }

        List<SkaterSeasonLine> roster = statsCache.get().skaters(team);
        double total = injured.stream()
                .mapToDouble(name -> importance(name, roster))
                .sum();

        double mult = Math.max(FLOOR, 1.0 - total * PENALTY_PER_POINT);
        String summary = injured.size() > 2
                ? injured.size() + " out"
                : String.join(", ", injured);
        return new Multiplier(mult, summary);
    }

    /**
     * 0-100 from points (40%, over 100), ice time (35%, over 30 hours) and expected goals
     * for (25%, over 60). Players not found on the roster count a flat 15.
     */
    double importance(String playerName, List<SkaterSeasonLine> roster) {
        Optional<SkaterSeasonLine> line = match(playerName, roster);
        if (line.isEmpty()) {
            return UNKNOWN_PLAYER_IMPORTANCE;
        }
        SkaterSeasonLine s = line.get();
        double toiHours = s.icetimeSeconds() / 3600.0;
        double importance = (Math.min(1, s.points() / 100.0) * 0.40
                + Math.min(1, toiHours / 30.0) * 0.35
                + Math.min(1, s.expectedGoalsFor() / 60.0) * 0.25) * 100;
        return Math.min(100, importance);
    }

    private static Optional<SkaterSeasonLine> match(String playerName, List<SkaterSeasonLine> roster) {
        if (playerName == null || playerName.isBlank()) {
            return Optional.empty();
        }
        String full = playerName.trim().toLowerCase(Locale.ROOT);
        Optional<SkaterSeasonLine> byFull = roster.stream()
                .filter(s -> s.name() != null && s.name().toLowerCase(Locale.ROOT).contains(full))
                .findFirst();
        if (byFull.isPresent()) {
            return byFull;
        }
        String[] parts = full.split("\\s+");
        String last = parts[parts.length - 1];
        return roster.stream()
                .filter(s -> s.name() != null && s.name().toLowerCase(Locale.ROOT).contains(last))
                .findFirst();
    }
}
