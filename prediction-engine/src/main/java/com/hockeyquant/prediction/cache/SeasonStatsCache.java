package com.hockeyquant.prediction.cache;

import com.hockeyquant.adapter.config.DataSourceProperties;
import com.hockeyquant.adapter.model.FetchResult;
import com.hockeyquant.adapter.model.SeasonTables;
import com.hockeyquant.adapter.provider.StatsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Holds the season-aggregate tables and reloads them once the stats TTL has passed.
 * Lives across slate runs; it is not cleared by a fresh analysis.
 *
 * <p>A failed reload keeps serving the previous tables (or empty tables if nothing has
 * loaded yet) and is retried after a short back-off instead of on every lookup.
 */
@Component
public class SeasonStatsCache {

    private static final Logger log = LoggerFactory.getLogger(SeasonStatsCache.class);

    static final Duration FAILURE_RETRY = Duration.ofMinutes(5);

    private final StatsProvider statsProvider;
    private final Duration ttl;
    private final Clock clock;

    private SeasonTables tables;
    private Instant nextRefreshAt;

    public SeasonStatsCache(StatsProvider statsProvider, DataSourceProperties properties, Clock clock) {
        this.statsProvider = statsProvider;
        this.ttl = properties.getStatsTtl();
        this.clock = clock;
    }

    public synchronized SeasonTables get() {
        Instant now = clock.instant();
        if (tables != null && nextRefreshAt != null && now.isBefore(nextRefreshAt)) {
            return tables;
        }

        FetchResult<SeasonTables> result = statsProvider.fetchSeasonTables();
        if (result.isSuccess()) {
            tables = result.getValue();
            nextRefreshAt = now.plus(ttl);
            log.debug("Season tables refreshed, next refresh at {}", nextRefreshAt);
        } else {
            log.warn("Season tables unavailable ({}), serving {} tables",
                    result.getError(), tables == null ? "empty" : "previous");
            if (tables == null) {
                tables = SeasonTables.empty();
            }
            nextRefreshAt = now.plus(FAILURE_RETRY);
        }
        return tables;
    }

    /**
     * Force the next {@link #get()} to reload.
     */
    public synchronized void invalidate() {
        nextRefreshAt = null;
    }
}
