package com.hockeyquant.prediction.cache;

import com.hockeyquant.adapter.model.FetchResult;
import com.hockeyquant.adapter.model.FetchError;
import com.hockeyquant.adapter.model.GameLogEntry;
import com.hockeyquant.adapter.model.NhlSeason;
import com.hockeyquant.adapter.model.TeamSeasonRecord;
import com.hockeyquant.adapter.provider.ScheduleProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Memoizes standings and per-team game logs for the duration of one analysis run, so
 * the multiplier calculators of every game share a single upstream fetch per key.
 *
 * <p>Concurrent first lookups of the same key wait on one in-flight fetch. A failed
 * fetch is memoized too: callers see an empty list for the rest of the run instead of
 * retrying. {@link #clear()} must be called before each fresh slate.
 */
@Component
public class RunScopedFetchCache {

    private static final Logger log = LoggerFactory.getLogger(RunScopedFetchCache.class);

    private final ScheduleProvider scheduleProvider;

    private final AtomicReference<CompletableFuture<FetchResult<List<TeamSeasonRecord>>>> standings =
            new AtomicReference<>();
    private final ConcurrentMap<GameLogKey, CompletableFuture<FetchResult<List<GameLogEntry>>>> gameLogs =
            new ConcurrentHashMap<>();

    public RunScopedFetchCache(ScheduleProvider scheduleProvider) {
        this.scheduleProvider = scheduleProvider;
    }

    public FetchResult<List<TeamSeasonRecord>> getStandingsResult() {
        CompletableFuture<FetchResult<List<TeamSeasonRecord>>> existing = standings.get();
        if (existing != null) {
            return existing.join();
        }
        CompletableFuture<FetchResult<List<TeamSeasonRecord>>> created = new CompletableFuture<>();
        if (standings.compareAndSet(null, created)) {
            log.debug("Standings cache miss");
            return load(created, scheduleProvider::fetchStandings, "standings");
        }
        return standings.get().join();
    }

    public List<TeamSeasonRecord> getStandings() {
        return getStandingsResult().orElse(List.of());
    }

    public Optional<TeamSeasonRecord> getStandings(String team) {
        return getStandings().stream()
                .filter(r -> r.team().equals(team))
                .findFirst();
    }

    public FetchResult<List<GameLogEntry>> getTeamGamesResult(String team, NhlSeason season) {
        GameLogKey key = new GameLogKey(team, season);
        CompletableFuture<FetchResult<List<GameLogEntry>>> created = new CompletableFuture<>();
        CompletableFuture<FetchResult<List<GameLogEntry>>> existing = gameLogs.putIfAbsent(key, created);
        if (existing != null) {
            return existing.join();
        }
        log.debug("Game log cache miss: {} {}", team, season);
        return load(created, () -> scheduleProvider.fetchTeamGames(team, season), "games " + key);
    }

    /**
     * Completed games for the team in the season, oldest first; empty if the fetch failed.
     */
    public List<GameLogEntry> getTeamGames(String team, NhlSeason season) {
        return getTeamGamesResult(team, season).orElse(List.of());
    }

    public void clear() {
        standings.set(null);
        gameLogs.clear();
        log.debug("Run-scoped fetch cache cleared");
    }

    private <T> FetchResult<T> load(CompletableFuture<FetchResult<T>> slot, Supplier<FetchResult<T>> fetch, String what) {
        FetchResult<T> result;
        try {
            result = fetch.get();
        } catch (RuntimeException e) {
            log.warn("Unexpected error fetching {}: {}", what, e.getMessage());
            result = FetchResult.failure(FetchError.unavailable(what + ": " + e.getMessage()));
        } catch (Error e) {
            // Waiters on this key still get a result; the error goes to the loading thread
            slot.complete(FetchResult.failure(FetchError.unavailable(what + ": " + e)));
            throw e;
        }
        if (!result.isSuccess()) {
            log.warn("Fetch of {} failed, memoizing empty result: {}", what, result.getError());
        }
        slot.complete(result);
        return result;
    }

    private record GameLogKey(String team, NhlSeason season) {
    }
}
