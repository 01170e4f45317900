package com.hockeyquant.prediction.service;

import com.hockeyquant.adapter.model.GoalieProfile;
import com.hockeyquant.adapter.model.TeamSeasonRecord;
import com.hockeyquant.adapter.model.TeamStatLine;
import com.hockeyquant.prediction.cache.RunScopedFetchCache;
import com.hockeyquant.prediction.cache.SeasonStatsCache;
import com.hockeyquant.prediction.goalie.GoalieSelector;
import com.hockeyquant.prediction.model.TeamAnalysis;
import com.hockeyquant.prediction.multiplier.FatigueCalculator;
import com.hockeyquant.prediction.multiplier.HeadToHeadCalculator;
import com.hockeyquant.prediction.multiplier.InjuryCalculator;
import com.hockeyquant.prediction.multiplier.Multiplier;
import com.hockeyquant.prediction.multiplier.SpecialTeamsCalculator;
import com.hockeyquant.prediction.multiplier.StreakCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Scores one side of a matchup from season quality, goaltending and the five
 * situational multipliers.
 */
@Service
public class TeamAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TeamAnalyzer.class);

    // Base score weights, summing to 100
    static final double OFFENSE_WEIGHT = 40;
    static final double DEFENSE_WEIGHT = 15;
    static final double POINTS_WEIGHT = 10;
    static final double GOALIE_WEIGHT = 30;
    static final double WIN_WEIGHT = 5;

    private final RunScopedFetchCache fetchCache;
    private final SeasonStatsCache statsCache;
    private final GoalieSelector goalieSelector;
    private final FatigueCalculator fatigueCalculator;
    private final StreakCalculator streakCalculator;
    private final SpecialTeamsCalculator specialTeamsCalculator;
    private final InjuryCalculator injuryCalculator;
    private final HeadToHeadCalculator headToHeadCalculator;
    private final Clock clock;

    public TeamAnalyzer(
            RunScopedFetchCache fetchCache,
            SeasonStatsCache statsCache,
            GoalieSelector goalieSelector,
            FatigueCalculator fatigueCalculator,
            StreakCalculator streakCalculator,
            SpecialTeamsCalculator specialTeamsCalculator,
            InjuryCalculator injuryCalculator,
            HeadToHeadCalculator headToHeadCalculator,
            Clock clock
    ) {
        this.fetchCache = fetchCache;
        this.statsCache = statsCache;
        this.goalieSelector = goalieSelector;
        this.fatigueCalculator = fatigueCalculator;
        this.streakCalculator = streakCalculator;
        this.specialTeamsCalculator = specialTeamsCalculator;
        this.injuryCalculator = injuryCalculator;
        this.headToHeadCalculator = headToHeadCalculator;
        this.clock = clock;
    }

    /**
     * Analyze a team for a game today.
     */
    public Optional<TeamAnalysis> analyzeTeam(String team, String opponent, boolean isAway, String goalieOverride) {
        return analyzeTeam(team, opponent, isAway, goalieOverride, LocalDate.now(clock));
    }

    /**
     * Analyze a team for a game on {@code gameDate}; lookback windows end the day before.
     *
     * @return empty when standings have no record for the team or it has not played yet
     */
    public Optional<TeamAnalysis> analyzeTeam(String team, String opponent, boolean isAway,
                                              String goalieOverride, LocalDate gameDate) {
        Optional<TeamSeasonRecord> standing = fetchCache.getStandings(team);
        if (standing.isEmpty()) {
            log.warn("No standings record for {}", team);
            return Optional.empty();
        }
        TeamSeasonRecord record = withExpectedGoals(standing.get());
        if (record.gamesPlayed() == 0) {
            log.debug("{} has no games played, skipping", team);
            return Optional.empty();
        }

        double offense = offensiveQuality(record);
        double defense = defensiveQuality(record);

        GoalieProfile starter = goalieSelector.selectStarter(team, goalieOverride).orElse(null);
        GoalieProfile backup = goalieSelector.selectBackup(team).orElse(null);
        double goalieScore = goalieSelector.score(starter);

        double baseScore = offense * OFFENSE_WEIGHT
                + defense * DEFENSE_WEIGHT
                + record.pointsPct() * POINTS_WEIGHT
                + goalieScore * GOALIE_WEIGHT
                + record.winPct() * WIN_WEIGHT;

        // Each multiplier stands alone; one falling back to neutral must not affect the others
        Multiplier fatigue = safely("fatigue", team,
                () -> fatigueCalculator.calculate(team, opponent, isAway, gameDate));
        Multiplier streak = safely("streak", team,
                () -> streakCalculator.calculate(team, record, gameDate));
        Multiplier specialTeams = safely("special teams", team,
                () -> specialTeamsCalculator.calculate(team, opponent));
        Multiplier injury = safely("injury", team,
                () -> injuryCalculator.calculate(team));
        Multiplier headToHead = safely("head-to-head", team,
                () -> headToHeadCalculator.calculate(team, opponent, gameDate));

        double finalScore = baseScore * fatigue.factor() * streak.factor() * specialTeams.factor()
                * injury.factor() * headToHead.factor();

        if (log.isDebugEnabled()) {
            log.debug("{} vs {}: base={}, final={}", team, opponent,
                    String.format("%.2f", baseScore), String.format("%.2f", finalScore));
        }

        return Optional.of(new TeamAnalysis(team, opponent, isAway, offense, defense, goalieScore,
                baseScore, finalScore, starter, backup, fatigue, streak, specialTeams, injury, headToHead));
    }

    /**
     * 80% expected-goals share, 20% actual goals share; either defaults to 0.5 when unknown.
     */
    static double offensiveQuality(TeamSeasonRecord r) {
        double xgfPct = r.hasExpectedGoals()
                ? r.expectedGoalsFor() / (r.expectedGoalsFor() + r.expectedGoalsAgainst())
                : 0.5;
        int goals = r.goalsFor() + r.goalsAgainst();
        double gfPct = goals > 0 ? r.goalsFor() / (double) goals : 0.5;
        return xgfPct * 0.8 + gfPct * 0.2;
    }

    static double defensiveQuality(TeamSeasonRecord r) {
        double xgaPct = r.hasExpectedGoals()
                ? r.expectedGoalsAgainst() / (r.expectedGoalsFor() + r.expectedGoalsAgainst())
                : 0.5;
        int goals = r.goalsFor() + r.goalsAgainst();
        double gaPct = goals > 0 ? r.goalsAgainst() / (double) goals : 0.5;
        return (1 - xgaPct) * 0.8 + (1 - gaPct) * 0.2;
    }

    private TeamSeasonRecord withExpectedGoals(TeamSeasonRecord record) {
        Optional<TeamStatLine> line = statsCache.get().teamLine(record.team());
        return line.map(l -> record.withExpectedGoals(l.expectedGoalsFor(), l.expectedGoalsAgainst()))
                .orElse(record);
    }

    private Multiplier safely(String name, String team, Supplier<Multiplier> calculation) {
        try {
            return calculation.get();
        } catch (RuntimeException e) {
            log.warn("{} multiplier failed for {}, using neutral: {}", name, team, e.getMessage());
            return Multiplier.neutral("No data");
        }
    }
}
