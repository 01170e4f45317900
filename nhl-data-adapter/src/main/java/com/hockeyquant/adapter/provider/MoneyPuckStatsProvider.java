package com.hockeyquant.adapter.provider;

import com.hockeyquant.adapter.client.MoneyPuckClient;
import com.hockeyquant.adapter.config.DataSourceProperties;
import com.hockeyquant.adapter.model.FetchResult;
import com.hockeyquant.adapter.model.GoalieProfile;
import com.hockeyquant.adapter.model.NhlSeason;
import com.hockeyquant.adapter.model.SeasonTables;
import com.hockeyquant.adapter.model.SkaterSeasonLine;
import com.hockeyquant.adapter.model.TeamStatLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * {@link StatsProvider} backed by MoneyPuck's season-summary CSVs. All three tables
 * must load for the result to succeed.
 */
@Service
public class MoneyPuckStatsProvider implements StatsProvider {

    private static final Logger log = LoggerFactory.getLogger(MoneyPuckStatsProvider.class);

    private final MoneyPuckClient client;
    private final MoneyPuckCsvParser parser;
    private final DataSourceProperties properties;
    private final Clock clock;

    public MoneyPuckStatsProvider(MoneyPuckClient client, MoneyPuckCsvParser parser,
                                  DataSourceProperties properties, Clock clock) {
        this.client = client;
        this.parser = parser;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public FetchResult<SeasonTables> fetchSeasonTables() {
        int season = seasonYear();
        try {
            List<TeamStatLine> teams = parser.parseTeams(client.getTeamsCsv(season));
            List<GoalieProfile> goalies = parser.parseGoalies(client.getGoaliesCsv(season));
            List<SkaterSeasonLine> skaters = parser.parseSkaters(client.getSkatersCsv(season));

            log.info("Loaded MoneyPuck {} tables: {} team rows, {} goalies, {} skaters",
                    season, teams.size(), goalies.size(), skaters.size());
            return FetchResult.success(new SeasonTables(teams, goalies, skaters));
        } catch (Exception e) {
            log.warn("MoneyPuck load failed for season {}: {}", season, e.getMessage());
            return FetchResult.failure(FetchErrors.classify("MoneyPuck " + season, e));
        }
    }

    int seasonYear() {
        Integer pinned = properties.getMoneyPuckSeason();
        if (pinned != null) {
            return pinned;
        }
        return NhlSeason.containing(LocalDate.now(clock)).startYear();
    }
}
