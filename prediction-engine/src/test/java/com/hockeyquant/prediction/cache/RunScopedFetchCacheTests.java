package com.hockeyquant.prediction.cache;

import com.hockeyquant.adapter.model.FetchError;
import com.hockeyquant.adapter.model.FetchResult;
import com.hockeyquant.adapter.model.GameLogEntry;
import com.hockeyquant.adapter.model.NhlSeason;
import com.hockeyquant.adapter.model.TeamSeasonRecord;
import com.hockeyquant.adapter.provider.ScheduleProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.hockeyquant.prediction.TestData.away;
import static com.hockeyquant.prediction.TestData.standing;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class RunScopedFetchCacheTests {

    static final NhlSeason CURRENT = new NhlSeason(2025);

    ScheduleProvider provider;
    RunScopedFetchCache cache;

    @BeforeEach
    void setUp() {
        provider = mock(ScheduleProvider.class);
        cache = new RunScopedFetchCache(provider);
    }

    @Test
    void standingsAreFetchedOncePerRun() {
        when(provider.fetchStandings()).thenReturn(FetchResult.success(List.of(standing("TOR"), standing("BOS"))));

        assertTrue(cache.getStandings("TOR").isPresent());
        assertTrue(cache.getStandings("BOS").isPresent());
        assertTrue(cache.getStandings("MTL").isEmpty());

        verify(provider, times(1)).fetchStandings();
    }

    @Test
    void gameLogsAreKeyedByTeamAndSeason() {
        GameLogEntry g = away(LocalDate.of(2025, 11, 1), "BOS", 3, 2);
        when(provider.fetchTeamGames(eq("TOR"), any())).thenReturn(FetchResult.success(List.of(g)));

        cache.getTeamGames("TOR", CURRENT);
        cache.getTeamGames("TOR", CURRENT);
        cache.getTeamGames("TOR", CURRENT.previous());

        verify(provider, times(1)).fetchTeamGames("TOR", CURRENT);
        verify(provider, times(1)).fetchTeamGames("TOR", CURRENT.previous());
    }

    @Test
    void failedFetchIsMemoizedAsEmpty() {
        when(provider.fetchTeamGames("TOR", CURRENT))
                .thenReturn(FetchResult.failure(FetchError.timeout("slow")));

        assertEquals(List.of(), cache.getTeamGames("TOR", CURRENT));
        assertFalse(cache.getTeamGamesResult("TOR", CURRENT).isSuccess());

        verify(provider, times(1)).fetchTeamGames("TOR", CURRENT);
    }

    @Test
    void providerExceptionDegradesToEmpty() {
        when(provider.fetchStandings()).thenThrow(new IllegalStateException("boom"));

        assertEquals(List.<TeamSeasonRecord>of(), cache.getStandings());
        assertEquals(FetchError.Kind.UNAVAILABLE, cache.getStandingsResult().getError().kind());
    }

    @Test
    void clearForcesRefetch() {
        when(provider.fetchStandings()).thenReturn(FetchResult.success(List.of(standing("TOR"))));
        when(provider.fetchTeamGames("TOR", CURRENT)).thenReturn(FetchResult.success(List.of()));

        cache.getStandings();
        cache.getTeamGames("TOR", CURRENT);
        cache.clear();
        cache.getStandings();
        cache.getTeamGames("TOR", CURRENT);

        verify(provider, times(2)).fetchStandings();
        verify(provider, times(2)).fetchTeamGames("TOR", CURRENT);
    }

    @Test
    void concurrentMissesShareOneFetch() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(provider.fetchTeamGames("TOR", CURRENT)).thenAnswer(inv -> {
            release.await(5, TimeUnit.SECONDS);
            return FetchResult.success(List.of());
        });

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<List<GameLogEntry>>> calls = List.of(
                    CompletableFuture.supplyAsync(() -> cache.getTeamGames("TOR", CURRENT), pool),
                    CompletableFuture.supplyAsync(() -> cache.getTeamGames("TOR", CURRENT), pool),
                    CompletableFuture.supplyAsync(() -> cache.getTeamGames("TOR", CURRENT), pool),
                    CompletableFuture.supplyAsync(() -> cache.getTeamGames("TOR", CURRENT), pool));
            Thread.sleep(100);
            release.countDown();
            for (CompletableFuture<List<GameLogEntry>> call : calls) {
                assertEquals(List.of(), call.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        verify(provider, times(1)).fetchTeamGames("TOR", CURRENT);
    }

    @Test
    void errorInFetchDoesNotLeaveWaitersHanging() {
        when(provider.fetchStandings()).thenThrow(new StackOverflowError());

        assertThrows(StackOverflowError.class, () -> cache.getStandingsResult());

        FetchResult<List<TeamSeasonRecord>> again =
                assertTimeoutPreemptively(Duration.ofSeconds(5), () -> cache.getStandingsResult());
        assertFalse(again.isSuccess());
        assertEquals(FetchError.Kind.UNAVAILABLE, again.getError().kind());
        verify(provider, times(1)).fetchStandings();
    }
}
