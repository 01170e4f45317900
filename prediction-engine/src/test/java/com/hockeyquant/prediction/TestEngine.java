package com.hockeyquant.prediction;

import com.hockeyquant.adapter.config.DataSourceProperties;
import com.hockeyquant.adapter.model.FetchResult;
import com.hockeyquant.adapter.model.GameLogEntry;
import com.hockeyquant.adapter.model.GoalieProfile;
import com.hockeyquant.adapter.model.NhlSeason;
import com.hockeyquant.adapter.model.SeasonTables;
import com.hockeyquant.adapter.model.SkaterSeasonLine;
import com.hockeyquant.adapter.model.TeamSeasonRecord;
import com.hockeyquant.adapter.model.TeamStatLine;
import com.hockeyquant.adapter.provider.InjuryFeed;
import com.hockeyquant.adapter.provider.ScheduleProvider;
import com.hockeyquant.adapter.provider.StatsProvider;
import com.hockeyquant.prediction.cache.RunScopedFetchCache;
import com.hockeyquant.prediction.cache.SeasonStatsCache;
import com.hockeyquant.prediction.goalie.GoalieSelector;
import com.hockeyquant.prediction.multiplier.FatigueCalculator;
import com.hockeyquant.prediction.multiplier.HeadToHeadCalculator;
import com.hockeyquant.prediction.multiplier.InjuryCalculator;
import com.hockeyquant.prediction.multiplier.SpecialTeamsCalculator;
import com.hockeyquant.prediction.multiplier.StreakCalculator;
import com.hockeyquant.prediction.service.TeamAnalyzer;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * The real engine components wired over mocked providers. Providers answer with empty
 * successful results until a test stubs them.
 */
public class TestEngine {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2025-11-20T17:00:00Z"), ZoneId.of("America/New_York"));

    public final ScheduleProvider schedule = mock(ScheduleProvider.class);
    public final StatsProvider stats = mock(StatsProvider.class);
    public final InjuryFeed injuries = mock(InjuryFeed.class);

    public final RunScopedFetchCache fetchCache;
    public final SeasonStatsCache statsCache;
    public final GoalieSelector goalieSelector;
    public final FatigueCalculator fatigue;
    public final StreakCalculator streak;
    public final SpecialTeamsCalculator specialTeams;
    public final InjuryCalculator injury;
    public final HeadToHeadCalculator headToHead;
    public final TeamAnalyzer analyzer;

    private final List<TeamSeasonRecord> standings = new ArrayList<>();
    private final List<TeamStatLine> teamLines = new ArrayList<>();
    private final List<GoalieProfile> goalies = new ArrayList<>();
    private final List<SkaterSeasonLine> skaters = new ArrayList<>();

    public TestEngine() {
        when(schedule.fetchStandings()).thenAnswer(inv -> FetchResult.success(List.copyOf(standings)));
        when(schedule.fetchTeamGames(anyString(), any())).thenReturn(FetchResult.success(List.of()));
        when(stats.fetchSeasonTables()).thenAnswer(inv -> FetchResult.success(
                new SeasonTables(List.copyOf(teamLines), List.copyOf(goalies), List.copyOf(skaters))));
        when(injuries.refresh()).thenReturn(FetchResult.success(Map.of()));
        when(injuries.getInjuries(anyString())).thenReturn(List.of());

        fetchCache = new RunScopedFetchCache(schedule);
        statsCache = new SeasonStatsCache(stats, new DataSourceProperties(), CLOCK);
        goalieSelector = new GoalieSelector(statsCache);
        fatigue = new FatigueCalculator(fetchCache);
        streak = new StreakCalculator(fetchCache);
        specialTeams = new SpecialTeamsCalculator(statsCache);
        injury = new InjuryCalculator(injuries, statsCache);
        headToHead = new HeadToHeadCalculator(fetchCache);
        analyzer = new TeamAnalyzer(fetchCache, statsCache, goalieSelector, fatigue, streak,
                specialTeams, injury, headToHead, CLOCK);
    }

    public TestEngine standing(TeamSeasonRecord record) {
        standings.add(record);
        return this;
    }

    public TestEngine teamLines(List<TeamStatLine> lines) {
        teamLines.addAll(lines);
        return this;
    }

    public TestEngine goalie(GoalieProfile goalie) {
        goalies.add(goalie);
        return this;
    }

    public TestEngine skater(SkaterSeasonLine skater) {
        skaters.add(skater);
        return this;
    }

    public TestEngine games(String team, NhlSeason season, GameLogEntry... games) {
        when(schedule.fetchTeamGames(team, season)).thenReturn(FetchResult.success(List.of(games)));
        return this;
    }

    public TestEngine injured(String team, String... players) {
        when(injuries.getInjuries(team)).thenReturn(List.of(players));
        return this;
    }
}
