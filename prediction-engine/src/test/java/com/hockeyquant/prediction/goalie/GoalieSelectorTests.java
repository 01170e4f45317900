package com.hockeyquant.prediction.goalie;

import com.hockeyquant.adapter.model.GoalieProfile;
import com.hockeyquant.prediction.TestEngine;
import org.junit.jupiter.api.Test;

import static com.hockeyquant.prediction.TestData.goalie;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GoalieSelectorTests {

    private GoalieSelector selectorWith(GoalieProfile... goalies) {
        TestEngine engine = new TestEngine();
        for (GoalieProfile g : goalies) {
            engine.goalie(g);
        }
        return engine.goalieSelector;
    }

    @Test
    void starterIsMostUsedQualifiedGoalie() {
        GoalieSelector selector = selectorWith(
                goalie("Joseph Woll", "TOR", 12, 4.0, 0.915, 2.6),
                goalie("Anthony Stolarz", "TOR", 8, 2.0, 0.910, 2.8),
                goalie("Dennis Hildeby", "TOR", 2, -1.0, 0.880, 3.4));

        assertThat(selector.selectStarter("TOR")).map(GoalieProfile::name).contains("Joseph Woll");
        assertThat(selector.selectBackup("TOR")).map(GoalieProfile::name).contains("Anthony Stolarz");
    }

    @Test
    void smallSampleRosterFallsBackToWholeRoster() {
        GoalieSelector selector = selectorWith(
                goalie("A Goalie", "SEA", 3, 0, 0.900, 3.0),
                goalie("B Goalie", "SEA", 2, 0, 0.900, 3.0));

        assertThat(selector.selectStarter("SEA")).map(GoalieProfile::name).contains("A Goalie");
        assertThat(selector.selectBackup("SEA")).map(GoalieProfile::name).contains("B Goalie");
    }

    @Test
    void singleGoalieHasNoBackup() {
        GoalieSelector selector = selectorWith(goalie("Solo", "UTA", 20, 0, 0.905, 2.9));

        assertThat(selector.selectBackup("UTA")).isEmpty();
        assertThat(selector.selectStarter("BOS")).isEmpty();
    }

    @Test
    void overrideMatchesExactlyThenBySubstring() {
        GoalieSelector selector = selectorWith(
                goalie("Joseph Woll", "TOR", 12, 4.0, 0.915, 2.6),
                goalie("Anthony Stolarz", "TOR", 8, 2.0, 0.910, 2.8));

        assertThat(selector.selectStarter("TOR", "Anthony Stolarz")).map(GoalieProfile::name).contains("Anthony Stolarz");
        assertThat(selector.selectStarter("TOR", "stolarz")).map(GoalieProfile::name).contains("Anthony Stolarz");
    }

    @Test
    void unknownOverrideFallsBackToAutoStarter() {
        GoalieSelector selector = selectorWith(
                goalie("Joseph Woll", "TOR", 12, 4.0, 0.915, 2.6),
                goalie("Anthony Stolarz", "TOR", 8, 2.0, 0.910, 2.8));

        assertThat(selector.selectStarter("TOR", "Frederik Andersen")).map(GoalieProfile::name).contains("Joseph Woll");
    }

    @Test
    void rankGoaliesOrdersByGamesPlayed() {
        GoalieSelector selector = selectorWith(
                goalie("Backup", "TOR", 8, 0, 0.9, 3.0),
                goalie("Starter", "TOR", 12, 0, 0.9, 3.0));

        assertThat(selector.rankGoalies("TOR")).extracting(GoalieProfile::name).containsExactly("Starter", "Backup");
    }

    @Test
    void scoreWeightsNormalizedComponents() {
        GoalieSelector selector = selectorWith();

        // gsax 10 -> 0.75, sv .910 -> 0.5, gaa 2.5 -> 0.75
        double score = selector.score(goalie("G", "TOR", 10, 10.0, 0.910, 2.5));

        assertThat(score).isCloseTo(0.75 * 0.5 + 0.5 * 0.3 + 0.75 * 0.2, within(1e-9));
    }

    @Test
    void scoreSaturatesOutOfBandStats() {
        GoalieSelector selector = selectorWith();

        assertThat(selector.score(goalie("Elite", "TOR", 40, 60.0, 0.950, 1.2))).isCloseTo(1.0, within(1e-9));
        assertThat(selector.score(goalie("Awful", "TOR", 40, -60.0, 0.850, 5.0))).isCloseTo(0.0, within(1e-9));
        assertThat(selector.score(null)).isEqualTo(0.5);
    }
}
