package com.hockeyquant.adapter.provider;

import com.hockeyquant.adapter.model.FetchResult;
import com.hockeyquant.adapter.model.SeasonTables;

public interface StatsProvider {

    FetchResult<SeasonTables> fetchSeasonTables();
}
