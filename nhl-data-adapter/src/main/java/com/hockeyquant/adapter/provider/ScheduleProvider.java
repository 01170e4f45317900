package com.hockeyquant.adapter.provider;

import com.hockeyquant.adapter.model.FetchResult;
import com.hockeyquant.adapter.model.FinalScore;
import com.hockeyquant.adapter.model.GameLogEntry;
import com.hockeyquant.adapter.model.NhlSeason;
import com.hockeyquant.adapter.model.ScheduledGame;
import com.hockeyquant.adapter.model.TeamSeasonRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Standings, game logs and daily schedules. Implementations never throw for upstream
 * problems; they return a failed {@link FetchResult} instead.
 */
public interface ScheduleProvider {

    FetchResult<List<TeamSeasonRecord>> fetchStandings();

    /**
     * Completed games of one club in one season, oldest first.
     */
    FetchResult<List<GameLogEntry>> fetchTeamGames(String team, NhlSeason season);

    FetchResult<List<ScheduledGame>> fetchGamesForDate(LocalDate date);

    /**
     * Final scores of the games on a date that have reached a terminal state.
     */
    FetchResult<List<FinalScore>> fetchResults(LocalDate date);
}
