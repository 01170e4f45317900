package com.hockeyquant.prediction.service;

import com.hockeyquant.adapter.model.NhlSeason;
import com.hockeyquant.adapter.model.TeamSeasonRecord;
import com.hockeyquant.prediction.TestEngine;
import com.hockeyquant.prediction.model.TeamAnalysis;
import com.hockeyquant.prediction.multiplier.Multiplier;
import com.hockeyquant.prediction.multiplier.StreakCalculator;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static com.hockeyquant.prediction.TestData.away;
import static com.hockeyquant.prediction.TestData.goalie;
import static com.hockeyquant.prediction.TestData.home;
import static com.hockeyquant.prediction.TestData.skater;
import static com.hockeyquant.prediction.TestData.standing;
import static com.hockeyquant.prediction.TestData.teamLines;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TeamAnalyzerTests {

    static final LocalDate TODAY = LocalDate.of(2025, 11, 20);
    static final NhlSeason SEASON = NhlSeason.containing(TODAY);

    TestEngine engine = new TestEngine();

    @Test
    void teamMissingFromStandingsIsNotAnalyzed() {
        engine.standing(standing("BOS"));

        assertThat(engine.analyzer.analyzeTeam("TOR", "BOS", false, null, TODAY)).isEmpty();
    }

    @Test
    void teamWithoutGamesPlayedIsNotAnalyzed() {
        engine.standing(standing("TOR", 0, 0, 0, 0, 0)).standing(standing("BOS"));

        assertThat(engine.analyzer.analyzeTeam("TOR", "BOS", false, null, TODAY)).isEmpty();
    }

    @Test
    void baseScoreWeighsSeasonQuality() {
        engine.standing(standing("TOR")).standing(standing("BOS"));

        TeamAnalysis a = engine.analyzer.analyzeTeam("TOR", "BOS", false, null, TODAY).orElseThrow();

        // Even goals, no xG, no goalie: 0.5*40 + 0.5*15 + 0.55*10 + 0.5*30 + 0.55*5
        assertThat(a.offensiveQuality()).isEqualTo(0.5);
        assertThat(a.defensiveQuality()).isEqualTo(0.5);
        assertThat(a.goalieScore()).isEqualTo(0.5);
        assertThat(a.baseScore()).isCloseTo(50.75, within(1e-9));
        assertThat(a.starterName()).isEqualTo("Unknown");
    }

    @Test
    void expectedGoalsAreJoinedFromSeasonTables() {
        engine.standing(standing("TOR")).standing(standing("BOS"))
                .teamLines(teamLines("TOR", 60, 40, 0.20, 0.80, 3.0));

        TeamAnalysis a = engine.analyzer.analyzeTeam("TOR", "BOS", false, null, TODAY).orElseThrow();

        assertThat(a.offensiveQuality()).isCloseTo(0.6 * 0.8 + 0.5 * 0.2, within(1e-9));
        assertThat(a.defensiveQuality()).isCloseTo(0.6 * 0.8 + 0.5 * 0.2, within(1e-9));
    }

    @Test
    void offensiveQualityRisesWithGoalsFor() {
        double lower = TeamAnalyzer.offensiveQuality(standing("TOR", 10, 8, 2, 60, 60));
        double higher = TeamAnalyzer.offensiveQuality(standing("TOR", 10, 8, 2, 70, 60));

        assertThat(higher).isGreaterThan(lower);
        assertThat(TeamAnalyzer.defensiveQuality(standing("TOR", 10, 8, 2, 60, 50)))
                .isGreaterThan(TeamAnalyzer.defensiveQuality(standing("TOR", 10, 8, 2, 60, 60)));
    }

    @Test
    void finalScoreIsBaseTimesEveryMultiplier() {
        populate(engine);

        TeamAnalysis a = engine.analyzer.analyzeTeam("TOR", "BOS", true, null, TODAY).orElseThrow();

        double product = a.fatigue().factor() * a.streak().factor() * a.specialTeams().factor()
                * a.injury().factor() * a.headToHead().factor();
        assertThat(a.finalScore()).isEqualTo(a.baseScore() * product);
        assertThat(a.combinedMultiplier()).isEqualTo(product);
    }

    @Test
    void multipliersStayFiniteAndWithinTheirBands() {
        populate(engine);

        TeamAnalysis a = engine.analyzer.analyzeTeam("TOR", "BOS", true, null, TODAY).orElseThrow();

        for (Multiplier m : List.of(a.fatigue(), a.streak(), a.specialTeams(), a.injury(), a.headToHead())) {
            assertThat(Double.isFinite(m.factor())).isTrue();
            assertThat(m.factor()).isPositive();
            assertThat(m.summary()).isNotBlank();
        }
        assertThat(a.specialTeams().factor()).isBetween(0.95, 1.05);
        assertThat(a.headToHead().factor()).isBetween(0.94, 1.06);
        assertThat(a.injury().factor()).isBetween(0.90, 1.0);
        assertThat(a.starterName()).isEqualTo("Joseph Woll");
        assertThat(a.backupName()).isEqualTo("Dennis Hildeby");
    }

    @Test
    void repeatedAnalysisIsIdentical() {
        populate(engine);

        TeamAnalysis first = engine.analyzer.analyzeTeam("TOR", "BOS", true, null, TODAY).orElseThrow();
        TeamAnalysis second = engine.analyzer.analyzeTeam("TOR", "BOS", true, null, TODAY).orElseThrow();

        assertThat(second.finalScore()).isEqualTo(first.finalScore());
        assertThat(second).isEqualTo(first);
    }

    @Test
    void failingMultiplierFallsBackWithoutAffectingOthers() {
        populate(engine);
        StreakCalculator broken = mock(StreakCalculator.class);
        when(broken.calculate(anyString(), any(TeamSeasonRecord.class), any(LocalDate.class)))
                .thenThrow(new IllegalStateException("bad game log"));
        TeamAnalyzer analyzer = new TeamAnalyzer(engine.fetchCache, engine.statsCache, engine.goalieSelector,
                engine.fatigue, broken, engine.specialTeams, engine.injury, engine.headToHead, TestEngine.CLOCK);

        TeamAnalysis healthy = engine.analyzer.analyzeTeam("TOR", "BOS", true, null, TODAY).orElseThrow();
        Optional<TeamAnalysis> degraded = analyzer.analyzeTeam("TOR", "BOS", true, null, TODAY);

        assertThat(degraded).isPresent();
        assertThat(degraded.get().streak()).isEqualTo(Multiplier.neutral("No data"));
        assertThat(degraded.get().fatigue()).isEqualTo(healthy.fatigue());
        assertThat(degraded.get().specialTeams()).isEqualTo(healthy.specialTeams());
        assertThat(degraded.get().injury()).isEqualTo(healthy.injury());
        assertThat(degraded.get().headToHead()).isEqualTo(healthy.headToHead());
    }

    @Test
    void goalieOverrideChangesGoalieScoreOnly() {
        populate(engine);

        TeamAnalysis auto = engine.analyzer.analyzeTeam("TOR", "BOS", true, null, TODAY).orElseThrow();
        TeamAnalysis backup = engine.analyzer.analyzeTeam("TOR", "BOS", true, "Hildeby", TODAY).orElseThrow();

        assertThat(backup.starterName()).isEqualTo("Dennis Hildeby");
        assertThat(backup.goalieScore()).isLessThan(auto.goalieScore());
        assertThat(backup.combinedMultiplier()).isEqualTo(auto.combinedMultiplier());
    }

    @Test
    void defaultDateComesFromClock() {
        populate(engine);

        TeamAnalysis today = engine.analyzer.analyzeTeam("TOR", "BOS", true, null).orElseThrow();

        assertThat(today).isEqualTo(engine.analyzer.analyzeTeam("TOR", "BOS", true, null, TODAY).orElseThrow());
    }

    private static void populate(TestEngine engine) {
        engine.standing(standing("TOR", 14, 5, 1, 70, 52))
                .standing(standing("BOS", 9, 9, 2, 55, 61))
                .teamLines(teamLines("TOR", 58, 45, 0.24, 0.82, 3.1))
                .teamLines(teamLines("BOS", 49, 52, 0.18, 0.77, 3.6))
                .goalie(goalie("Joseph Woll", "TOR", 15, 6.0, 0.915, 2.6))
                .goalie(goalie("Dennis Hildeby", "TOR", 5, -2.0, 0.895, 3.2))
                .goalie(goalie("Jeremy Swayman", "BOS", 16, 1.0, 0.905, 2.9))
                .skater(skater("Auston Matthews", "TOR", 25, 8, 12))
                .injured("TOR", "Auston Matthews")
                .games("TOR", SEASON,
                        away(TODAY.minusDays(1), "MTL", 4, 2),
                        home(TODAY.minusDays(3), "BOS", 3, 1),
                        home(TODAY.minusDays(5), "DET", 2, 3),
                        away(TODAY.minusDays(8), "OTT", 5, 2),
                        home(TODAY.minusDays(10), "BUF", 3, 2),
                        away(TODAY.minusDays(12), "BOS", 2, 4));
    }
}
