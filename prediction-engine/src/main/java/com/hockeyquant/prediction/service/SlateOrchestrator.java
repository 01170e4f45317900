package com.hockeyquant.prediction.service;

import com.hockeyquant.adapter.model.FetchResult;
import com.hockeyquant.adapter.model.InjuryReport;
import com.hockeyquant.adapter.model.ScheduledGame;
import com.hockeyquant.adapter.provider.InjuryFeed;
import com.hockeyquant.adapter.provider.ScheduleProvider;
import com.hockeyquant.prediction.cache.RunScopedFetchCache;
import com.hockeyquant.prediction.config.EngineProperties;
import com.hockeyquant.prediction.model.GamePrediction;
import com.hockeyquant.prediction.model.TeamAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs the analysis for every game on a date and ranks the picks, most confident first.
 *
 * <p>A fresh run clears the run-scoped cache and refreshes injuries once. A run with
 * goalie overrides reuses whatever the previous run cached, since only the goaltending
 * term changes. Games that fail are logged and left out; only a failure to fetch the
 * game list aborts the run.
 */
@Service
public class SlateOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SlateOrchestrator.class);

    private final ScheduleProvider scheduleProvider;
    private final InjuryFeed injuryFeed;
    private final RunScopedFetchCache fetchCache;
    private final TeamAnalyzer teamAnalyzer;
    private final Executor slateExecutor;
    private final EngineProperties properties;

    public SlateOrchestrator(
            ScheduleProvider scheduleProvider,
            InjuryFeed injuryFeed,
            RunScopedFetchCache fetchCache,
            TeamAnalyzer teamAnalyzer,
            @Qualifier("slateExecutor") Executor slateExecutor,
            EngineProperties properties
    ) {
        this.scheduleProvider = scheduleProvider;
        this.injuryFeed = injuryFeed;
        this.fetchCache = fetchCache;
        this.teamAnalyzer = teamAnalyzer;
        this.slateExecutor = slateExecutor;
        this.properties = properties;
    }

    public List<GamePrediction> analyze(LocalDate date) {
        return analyze(date, Map.of());
    }

    /**
     * @param goalieOverrides team abbreviation to goalie name; non-empty means this is a
     *                        rerun on the warm cache rather than a fresh slate
     * @throws SlateUnavailableException if the game list for the date cannot be fetched
     */
    public List<GamePrediction> analyze(LocalDate date, Map<String, String> goalieOverrides) {
        Map<String, String> overrides = goalieOverrides == null ? Map.of() : goalieOverrides;

        if (overrides.isEmpty()) {
            fetchCache.clear();
            FetchResult<Map<String, InjuryReport>> injuries = injuryFeed.refresh();
            if (!injuries.isSuccess()) {
                log.warn("Injury refresh failed, using last known injuries: {}", injuries.getError());
            }
        } else {
            log.info("Rerunning {} with goalie overrides {}", date, overrides);
        }

        FetchResult<List<ScheduledGame>> schedule = scheduleProvider.fetchGamesForDate(date);
        if (!schedule.isSuccess()) {
            throw new SlateUnavailableException(date, schedule.getError());
        }
        List<ScheduledGame> games = schedule.getValue();
        if (games.isEmpty()) {
            log.info("No games scheduled on {}", date);
            return List.of();
        }

        log.info("Analyzing {} games on {}", games.size(), date);
        List<GamePrediction> predictions = new ArrayList<>();
        for (Optional<GamePrediction> result : analyzeAll(date, games, overrides)) {
            result.ifPresent(predictions::add);
        }

        predictions.sort(Comparator.comparingDouble(GamePrediction::scoreDiff).reversed());
        log.info("Slate {} done: {} predictions, {} games skipped",
                date, predictions.size(), games.size() - predictions.size());
        return predictions;
    }

    /**
     * New prediction for a single game with the given goalies, computed from the warm
     * cache. The passed prediction is left untouched.
     */
    public GamePrediction recompute(GamePrediction prediction, LocalDate date, String awayGoalie, String homeGoalie) {
        String away = prediction.away().team();
        String home = prediction.home().team();
        TeamAnalysis awayAnalysis = teamAnalyzer.analyzeTeam(away, home, true, awayGoalie, date)
                .orElseThrow(() -> new IllegalStateException("Cannot re-analyze " + away + " on " + date));
        TeamAnalysis homeAnalysis = teamAnalyzer.analyzeTeam(home, away, false, homeGoalie, date)
                .orElseThrow(() -> new IllegalStateException("Cannot re-analyze " + home + " on " + date));
        return GamePrediction.of(awayAnalysis, homeAnalysis);
    }

    private List<Optional<GamePrediction>> analyzeAll(LocalDate date, List<ScheduledGame> games,
                                                      Map<String, String> overrides) {
        if (properties.getParallelism() <= 1 || games.size() == 1) {
            return games.stream().map(g -> analyzeGame(date, g, overrides)).toList();
        }

        List<CompletableFuture<Optional<GamePrediction>>> futures = new ArrayList<>();
        for (ScheduledGame game : games) {
            futures.add(submit(() -> analyzeGame(date, game, overrides)));
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private CompletableFuture<Optional<GamePrediction>> submit(Supplier<Optional<GamePrediction>> task) {
        try {
            return CompletableFuture.supplyAsync(task, slateExecutor);
        } catch (RejectedExecutionException e) {
            log.debug("Slate executor saturated, analyzing on caller thread");
            return CompletableFuture.completedFuture(task.get());
        }
    }

    Optional<GamePrediction> analyzeGame(LocalDate date, ScheduledGame game, Map<String, String> overrides) {
        try {
            Optional<TeamAnalysis> away = teamAnalyzer.analyzeTeam(
                    game.away(), game.home(), true, overrides.get(game.away()), date);
            Optional<TeamAnalysis> home = teamAnalyzer.analyzeTeam(
                    game.home(), game.away(), false, overrides.get(game.home()), date);

            if (away.isEmpty() || home.isEmpty()) {
                log.warn("Skipping {}: missing season record for {}", game,
                        away.isEmpty() ? game.away() : game.home());
                return Optional.empty();
            }
            return Optional.of(GamePrediction.of(away.get(), home.get()));
        } catch (Exception e) {
            log.warn("Failed to analyze {}: {}", game, e.getMessage());
            return Optional.empty();
        }
    }
}
