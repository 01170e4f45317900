package com.hockeyquant.adapter.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.hockeyquant.adapter.client.NhlApiClient;
import com.hockeyquant.adapter.model.FetchResult;
import com.hockeyquant.adapter.model.FinalScore;
import com.hockeyquant.adapter.model.GameLogEntry;
import com.hockeyquant.adapter.model.GameResult;
import com.hockeyquant.adapter.model.NhlSeason;
import com.hockeyquant.adapter.model.ScheduledGame;
import com.hockeyquant.adapter.model.TeamSeasonRecord;
import com.hockeyquant.adapter.model.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * {@link ScheduleProvider} backed by the NHL web API.
 */
@Service
public class NhlScheduleProvider implements ScheduleProvider {

    private static final Logger log = LoggerFactory.getLogger(NhlScheduleProvider.class);

    private static final Set<String> TERMINAL_STATES = Set.of("OFF", "FINAL");

    private final NhlApiClient client;

    public NhlScheduleProvider(NhlApiClient client) {
        this.client = client;
    }

    @Override
    public FetchResult<List<TeamSeasonRecord>> fetchStandings() {
        try {
            JsonNode root = client.getStandings();
            JsonNode standings = requireArray(root, "standings");

            List<TeamSeasonRecord> records = new ArrayList<>();
            for (JsonNode node : standings) {
                String team = getTextOrNull(node.path("teamAbbrev"), "default");
                if (team == null) continue;

                records.add(new TeamSeasonRecord(
                        team,
                        node.path("wins").asInt(0),
                        node.path("losses").asInt(0),
                        node.path("otLosses").asInt(0),
                        node.path("points").asInt(0),
                        node.path("goalFor").asInt(0),
                        node.path("goalAgainst").asInt(0),
                        null,
                        null));
            }
            log.debug("Fetched standings for {} teams", records.size());
            return FetchResult.success(records);
        } catch (Exception e) {
            log.warn("Standings fetch failed: {}", e.getMessage());
            return FetchResult.failure(FetchErrors.classify("standings", e));
        }
    }

    @Override
    public FetchResult<List<GameLogEntry>> fetchTeamGames(String team, NhlSeason season) {
        try {
            JsonNode root = client.getClubSchedule(team, season.code());
            JsonNode games = requireArray(root, "games");

            List<GameLogEntry> entries = new ArrayList<>();
            for (JsonNode game : games) {
                GameLogEntry entry = toLogEntry(team, game);
                if (entry != null) {
                    entries.add(entry);
                }
            }
            entries.sort(Comparator.comparing(GameLogEntry::date));
            log.debug("Fetched {} completed games for {} in {}", entries.size(), team, season);
            return FetchResult.success(entries);
        } catch (Exception e) {
            log.warn("Game log fetch failed for {} in {}: {}", team, season, e.getMessage());
            return FetchResult.failure(FetchErrors.classify("club schedule " + team + " " + season, e));
        }
    }

    @Override
    public FetchResult<List<ScheduledGame>> fetchGamesForDate(LocalDate date) {
        try {
            JsonNode root = client.getSchedule(date);
            JsonNode gameWeek = requireArray(root, "gameWeek");
            String wanted = date.toString();

            List<ScheduledGame> games = new ArrayList<>();
            for (JsonNode day : gameWeek) {
                if (!wanted.equals(getTextOrNull(day, "date"))) continue;

                for (JsonNode game : day.path("games")) {
                    String away = getTextOrNull(game.path("awayTeam"), "abbrev");
                    String home = getTextOrNull(game.path("homeTeam"), "abbrev");
                    if (away != null && home != null) {
                        games.add(new ScheduledGame(away, home));
                    }
                }
            }
            log.debug("Found {} games scheduled on {}", games.size(), date);
            return FetchResult.success(games);
        } catch (Exception e) {
            log.warn("Schedule fetch failed for {}: {}", date, e.getMessage());
            return FetchResult.failure(FetchErrors.classify("schedule " + date, e));
        }
    }

    @Override
    public FetchResult<List<FinalScore>> fetchResults(LocalDate date) {
        try {
            JsonNode root = client.getScore(date);
            JsonNode games = requireArray(root, "games");

            List<FinalScore> results = new ArrayList<>();
            for (JsonNode game : games) {
                if (!TERMINAL_STATES.contains(getTextOrNull(game, "gameState"))) continue;

                JsonNode away = game.path("awayTeam");
                JsonNode home = game.path("homeTeam");
                String awayAbbrev = getTextOrNull(away, "abbrev");
                String homeAbbrev = getTextOrNull(home, "abbrev");
                if (awayAbbrev == null || homeAbbrev == null) continue;

                results.add(new FinalScore(
                        game.path("id").asText(""),
                        awayAbbrev,
                        homeAbbrev,
                        away.path("score").asInt(0),
                        home.path("score").asInt(0)));
            }
            log.debug("Fetched {} final scores for {}", results.size(), date);
            return FetchResult.success(results);
        } catch (Exception e) {
            log.warn("Score fetch failed for {}: {}", date, e.getMessage());
            return FetchResult.failure(FetchErrors.classify("score " + date, e));
        }
    }

    /**
     * Map a raw club-schedule game to the team's view of it, or null when the game has not
     * finished or the team did not play in it.
     */
    static GameLogEntry toLogEntry(String team, JsonNode game) {
        if (!TERMINAL_STATES.contains(getTextOrNull(game, "gameState"))) {
            return null;
        }
        JsonNode home = game.path("homeTeam");
        JsonNode away = game.path("awayTeam");
        String homeAbbrev = getTextOrNull(home, "abbrev");
        String awayAbbrev = getTextOrNull(away, "abbrev");

        Venue venue;
        if (team.equals(homeAbbrev)) {
            venue = Venue.HOME;
        } else if (team.equals(awayAbbrev)) {
            venue = Venue.AWAY;
        } else {
            return null;
        }

        String dateStr = getTextOrNull(game, "gameDate");
        if (dateStr == null || dateStr.length() < 10) {
            return null;
        }
        LocalDate date;
        try {
            date = LocalDate.parse(dateStr.substring(0, 10));
        } catch (DateTimeParseException e) {
            log.warn("Skipping game with bad date '{}' for {}", dateStr, team);
            return null;
        }

        int homeScore = home.path("score").asInt(0);
        int awayScore = away.path("score").asInt(0);
        int gf = venue == Venue.HOME ? homeScore : awayScore;
        int ga = venue == Venue.HOME ? awayScore : homeScore;
        String opponent = venue == Venue.HOME ? awayAbbrev : homeAbbrev;
        int lastPeriod = game.path("periodDescriptor").path("number").asInt(3);

        GameResult result = GameLogEntry.resultOf(gf, ga, lastPeriod);
        return new GameLogEntry(date, opponent == null ? "UNK" : opponent, venue, result, gf, ga);
    }

    private static JsonNode requireArray(JsonNode root, String field) {
        JsonNode node = root == null ? null : root.get(field);
        if (node == null || !node.isArray()) {
            throw new MalformedPayloadException("expected array field '" + field + "'");
        }
        return node;
    }

    private static String getTextOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return (value != null && !value.isNull()) ? value.asText() : null;
    }
}
