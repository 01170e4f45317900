package com.hockeyquant.adapter.model;

/**
 * A matchup on a slate, away side first.
 */
public record ScheduledGame(String away, String home) {

    @Override
    public String toString() {
        return away + " @ " + home;
    }
}
