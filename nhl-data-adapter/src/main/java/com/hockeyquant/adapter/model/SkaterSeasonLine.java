package com.hockeyquant.adapter.model;

/**
 * Skater production used to weigh how much an injured player matters.
 *
 * @param points          goals plus primary and secondary assists
 * @param icetimeSeconds  total all-situations ice time
 * @param expectedGoalsFor on-ice expected goals for
 */
public record SkaterSeasonLine(
        String name,
        String team,
        double points,
        double icetimeSeconds,
        double expectedGoalsFor
) {
}
