package com.hockeyquant.adapter.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hockeyquant.adapter.client.NhlApiClient;
import com.hockeyquant.adapter.model.FetchError;
import com.hockeyquant.adapter.model.FetchResult;
import com.hockeyquant.adapter.model.FinalScore;
import com.hockeyquant.adapter.model.GameLogEntry;
import com.hockeyquant.adapter.model.GameResult;
import com.hockeyquant.adapter.model.NhlSeason;
import com.hockeyquant.adapter.model.ScheduledGame;
import com.hockeyquant.adapter.model.TeamSeasonRecord;
import com.hockeyquant.adapter.model.Venue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class NhlScheduleProviderTests {

    ObjectMapper mapper = new ObjectMapper();
    NhlApiClient client;
    NhlScheduleProvider provider;

    @BeforeEach
    void setUp() {
        client = mock(NhlApiClient.class);
        provider = new NhlScheduleProvider(client);
    }

    @Test
    void standingsAreMappedFromNestedAbbreviation() {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode tor = root.putArray("standings").addObject();
        tor.putObject("teamAbbrev").put("default", "TOR");
        tor.put("wins", 20).put("losses", 10).put("otLosses", 4).put("points", 44)
                .put("goalFor", 110).put("goalAgainst", 95);
        when(client.getStandings()).thenReturn(root);

        FetchResult<List<TeamSeasonRecord>> result = provider.fetchStandings();

        assertTrue(result.isSuccess());
        TeamSeasonRecord record = result.getValue().get(0);
        assertEquals("TOR", record.team());
        assertEquals(34, record.gamesPlayed());
        assertEquals(110, record.goalsFor());
        assertFalse(record.hasExpectedGoals());
    }

    @Test
    void standingsWithoutArrayAreMalformed() {
        when(client.getStandings()).thenReturn(mapper.createObjectNode());

        FetchResult<List<TeamSeasonRecord>> result = provider.fetchStandings();

        assertFalse(result.isSuccess());
        assertEquals(FetchError.Kind.MALFORMED, result.getError().kind());
    }

    @Test
    void clientFailureBecomesUnavailableResult() {
        when(client.getStandings()).thenThrow(new NhlApiClient.NhlApiException("connection refused", null));

        FetchResult<List<TeamSeasonRecord>> result = provider.fetchStandings();

        assertFalse(result.isSuccess());
        assertEquals(FetchError.Kind.UNAVAILABLE, result.getError().kind());
        assertEquals(List.of(), result.orElse(List.of()));
    }

    @Test
    void gameLogKeepsOnlyFinishedGamesAndDerivesOvertimeLosses() {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode games = root.putArray("games");
        game(games, "2025-11-01", "OFF", "TOR", 2, "BOS", 3, 4);   // TOR home, lost in OT
        game(games, "2025-10-28", "FINAL", "MTL", 1, "TOR", 4, 3); // TOR away, won
        game(games, "2025-11-03", "FUT", "TOR", 0, "OTT", 0, 1);   // not played yet
        game(games, "2025-10-30", "OFF", "TOR", 1, "DET", 2, 3);   // regulation loss
        when(client.getClubSchedule("TOR", "20252026")).thenReturn(root);

        List<GameLogEntry> log = provider.fetchTeamGames("TOR", new NhlSeason(2025)).getValue();

        assertEquals(3, log.size());
        assertEquals(LocalDate.of(2025, 10, 28), log.get(0).date(), "oldest first");
        assertEquals(Venue.AWAY, log.get(0).venue());
        assertEquals(GameResult.WIN, log.get(0).result());
        assertEquals("MTL", log.get(0).opponent());
        assertEquals(GameResult.LOSS, log.get(1).result());
        assertEquals(GameResult.OT_LOSS, log.get(2).result());
        assertEquals(-1, log.get(2).goalDiff());
    }

    @Test
    void gamesForDatePicksOnlyTheRequestedDay() {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode week = root.putArray("gameWeek");
        ObjectNode day1 = week.addObject().put("date", "2025-11-05");
        matchup(day1.putArray("games"), "BOS", "TOR");
        matchup((ArrayNode) day1.get("games"), "EDM", "CGY");
        ObjectNode day2 = week.addObject().put("date", "2025-11-06");
        matchup(day2.putArray("games"), "VAN", "SEA");
        when(client.getSchedule(LocalDate.of(2025, 11, 5))).thenReturn(root);

        List<ScheduledGame> games = provider.fetchGamesForDate(LocalDate.of(2025, 11, 5)).getValue();

        assertEquals(List.of(new ScheduledGame("BOS", "TOR"), new ScheduledGame("EDM", "CGY")), games);
    }

    @Test
    void resultsSkipGamesInProgress() {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode games = root.putArray("games");
        ObjectNode done = games.addObject().put("id", 2025020101).put("gameState", "OFF");
        done.putObject("awayTeam").put("abbrev", "BOS").put("score", 2);
        done.putObject("homeTeam").put("abbrev", "TOR").put("score", 5);
        ObjectNode live = games.addObject().put("id", 2025020102).put("gameState", "LIVE");
        live.putObject("awayTeam").put("abbrev", "EDM").put("score", 1);
        live.putObject("homeTeam").put("abbrev", "CGY").put("score", 0);
        when(client.getScore(LocalDate.of(2025, 11, 5))).thenReturn(root);

        List<FinalScore> results = provider.fetchResults(LocalDate.of(2025, 11, 5)).getValue();

        assertEquals(1, results.size());
        assertEquals("TOR", results.get(0).winner());
        assertEquals("2025020101", results.get(0).gameId());
    }

    private void game(ArrayNode games, String date, String state,
                      String home, int homeScore, String away, int awayScore, int period) {
        ObjectNode g = games.addObject().put("gameDate", date).put("gameState", state);
        g.putObject("homeTeam").put("abbrev", home).put("score", homeScore);
        g.putObject("awayTeam").put("abbrev", away).put("score", awayScore);
        g.putObject("periodDescriptor").put("number", period);
    }

    private JsonNode matchup(ArrayNode games, String away, String home) {
        ObjectNode g = games.addObject();
        g.putObject("awayTeam").put("abbrev", away);
        g.putObject("homeTeam").put("abbrev", home);
        return g;
    }
}
