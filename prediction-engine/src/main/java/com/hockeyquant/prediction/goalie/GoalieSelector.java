package com.hockeyquant.prediction.goalie;

import com.hockeyquant.adapter.model.GoalieProfile;
import com.hockeyquant.prediction.cache.SeasonStatsCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks a team's starter and backup from the goalie season table and rates goalies
 * on a 0-1 scale.
 */
@Component
public class GoalieSelector {

    private static final Logger log = LoggerFactory.getLogger(GoalieSelector.class);

    static final int STARTER_MIN_GAMES = 5;
    static final int BACKUP_MIN_GAMES = 3;
    static final double NEUTRAL_SCORE = 0.5;

    private static final Comparator<GoalieProfile> BY_GAMES_DESC =
            Comparator.comparingInt(GoalieProfile::gamesPlayed).reversed();

    private final SeasonStatsCache statsCache;

    public GoalieSelector(SeasonStatsCache statsCache) {
        this.statsCache = statsCache;
    }

    /**
     * The requested goalie if the name matches one on the team, otherwise the auto-selected
     * starter: the most-used goalie among those with at least five games.
     */
    public Optional<GoalieProfile> selectStarter(String team, String overrideName) {
        List<GoalieProfile> goalies = statsCache.get().goalies(team);
        if (goalies.isEmpty()) {
            return Optional.empty();
        }

        if (overrideName != null && !overrideName.isBlank()) {
            Optional<GoalieProfile> requested = findByName(goalies, overrideName);
            if (requested.isPresent()) {
                return requested;
            }
            log.info("Goalie override '{}' not found for {}, using auto-selected starter", overrideName, team);
        }

        return qualified(goalies, STARTER_MIN_GAMES, 1).stream()
                .max(Comparator.comparingInt(GoalieProfile::gamesPlayed));
    }

    public Optional<GoalieProfile> selectStarter(String team) {
        return selectStarter(team, null);
    }

    /**
     * Second-most-used goalie among those with at least three games, or the whole roster
     * when fewer than two qualify. Empty for a team with a single goalie.
     */
    public Optional<GoalieProfile> selectBackup(String team) {
        List<GoalieProfile> goalies = statsCache.get().goalies(team);
        if (goalies.size() < 2) {
            return Optional.empty();
        }
        List<GoalieProfile> ranked = qualified(goalies, BACKUP_MIN_GAMES, 2).stream()
                .sorted(BY_GAMES_DESC)
                .toList();
        return ranked.size() < 2 ? Optional.empty() : Optional.of(ranked.get(1));
    }

    /**
     * All of a team's goalies, most games played first.
     */
    public List<GoalieProfile> rankGoalies(String team) {
        return statsCache.get().goalies(team).stream()
                .sorted(BY_GAMES_DESC)
                .toList();
    }

    /**
     * Weighted composite: GSAx over 40 centred on 0.5 (50%), save percentage over
     * .890-.930 (30%), GAA over 2.0-4.0 inverted (20%). Each term is clamped to [0, 1].
     */
    public double score(GoalieProfile goalie) {
        if (goalie == null) {
            return NEUTRAL_SCORE;
        }
        double gsaxNorm = clamp01(0.5 + goalie.goalsSavedAboveExpected() / 40.0);
        double svNorm = clamp01((goalie.savePct() - 0.890) / 0.040);
        double gaaNorm = clamp01(1 - (goalie.goalsAgainstAverage() - 2.0) / 2.0);
        return gsaxNorm * 0.50 + svNorm * 0.30 + gaaNorm * 0.20;
    }

    private static List<GoalieProfile> qualified(List<GoalieProfile> goalies, int minGames, int minCount) {
        List<GoalieProfile> pool = goalies.stream().filter(g -> g.gamesPlayed() >= minGames).toList();
        return pool.size() < minCount ? goalies : pool;
    }

    private static Optional<GoalieProfile> findByName(List<GoalieProfile> goalies, String name) {
        Optional<GoalieProfile> exact = goalies.stream().filter(g -> g.name().equals(name)).findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return goalies.stream()
                .filter(g -> g.name() != null && g.name().toLowerCase(Locale.ROOT).contains(lower))
                .findFirst();
    }

    private static double clamp01(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
