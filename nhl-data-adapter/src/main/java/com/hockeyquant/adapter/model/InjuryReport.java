package com.hockeyquant.adapter.model;

import java.time.Instant;
import java.util.List;

/**
 * Injured players for one club as last reported by the feed.
 */
public record InjuryReport(String team, List<String> players, Instant fetchedAt) {

    public InjuryReport {
        players = players == null ? List.of() : List.copyOf(players);
    }

    public static InjuryReport healthy(String team, Instant fetchedAt) {
        return new InjuryReport(team, List.of(), fetchedAt);
    }
}
