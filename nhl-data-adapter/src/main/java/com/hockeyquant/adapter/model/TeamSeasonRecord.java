package com.hockeyquant.adapter.model;

/**
 * A club's season to date: standings counts from the schedule provider, optionally
 * joined with expected-goals totals from the stats provider.
 *
 * <p>{@code expectedGoalsFor}/{@code expectedGoalsAgainst} are null when the stats
 * table has no row for the team.
 */
public record TeamSeasonRecord(
        String team,
        int wins,
        int losses,
        int otLosses,
        int points,
        int goalsFor,
        int goalsAgainst,
        Double expectedGoalsFor,
        Double expectedGoalsAgainst
) {
    public int gamesPlayed() {
        return wins + losses + otLosses;
    }

    public boolean hasExpectedGoals() {
        return expectedGoalsFor != null && expectedGoalsAgainst != null
                && expectedGoalsFor + expectedGoalsAgainst > 0;
    }

    /**
     * Win rate with OT-losses worth half a win.
     */
    public double winPct() {
        int gp = gamesPlayed();
        return gp == 0 ? 0.0 : (wins + otLosses * 0.5) / gp;
    }

    public double pointsPct() {
        int gp = gamesPlayed();
        return gp == 0 ? 0.0 : points / (gp * 2.0);
    }

    public TeamSeasonRecord withExpectedGoals(double xgf, double xga) {
        return new TeamSeasonRecord(team, wins, losses, otLosses, points, goalsFor, goalsAgainst, xgf, xga);
    }
}
