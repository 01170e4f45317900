package com.hockeyquant.adapter.provider;

import com.hockeyquant.adapter.model.FetchResult;
import com.hockeyquant.adapter.model.InjuryReport;

import java.util.List;
import java.util.Map;

/**
 * Currently injured players per club. The feed owns its own freshness policy.
 */
public interface InjuryFeed {

    /**
     * Pull a new snapshot from upstream. On failure the previous snapshot stays in place.
     */
    FetchResult<Map<String, InjuryReport>> refresh();

    /**
     * Injured player names for the team, refreshing first if the snapshot has gone stale.
     */
    List<String> getInjuries(String team);
}
