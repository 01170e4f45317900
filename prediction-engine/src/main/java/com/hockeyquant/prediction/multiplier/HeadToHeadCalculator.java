package com.hockeyquant.prediction.multiplier;

import com.hockeyquant.adapter.model.NhlSeason;
import com.hockeyquant.adapter.model.TeamRelationship;
import com.hockeyquant.prediction.cache.RunScopedFetchCache;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Recent meetings between the two clubs over this season and last, kept within
 * [0.94, 1.06]. Division rivals are looked at over more games than cross-conference
 * opponents.
 */
@Component
public class HeadToHeadCalculator {

    static final int MIN_MEETINGS = 2;
    static final double MIN = 0.94;
    static final double MAX = 1.06;

    private final RunScopedFetchCache fetchCache;

    public HeadToHeadCalculator(RunScopedFetchCache fetchCache) {
        this.fetchCache = fetchCache;
    }

    public Multiplier calculate(String team, String opponent, LocalDate asOf) {
        int depth = TeamRelationship.between(team, opponent).getHeadToHeadDepth();
        List<HeadToHeadEntry> meetings = history(team, opponent, depth, asOf);
        if (meetings.size() < MIN_MEETINGS) {
            return Multiplier.neutral("No H2H data");
        }

        int total = meetings.size();
        int wins = (int) meetings.stream().filter(HeadToHeadEntry::won).count();
        double avgGd = meetings.stream().mapToInt(HeadToHeadEntry::goalDiff).sum() / (double) total;
        double winPct = wins / (double) total;

        double mult = 1.0 + (winPct - 0.5) * 0.08 + avgGd * 0.01;
        mult = Multiplier.clamp(mult, MIN, MAX);

        String summary = String.format(Locale.ROOT, "%d-%d (%+.1f GD)", wins, total - wins, avgGd);
        return new Multiplier(mult, summary);
    }

    /**
     * Most recent completed meetings before {@code asOf}, newest first, at most {@code depth}.
     */
    List<HeadToHeadEntry> history(String team, String opponent, int depth, LocalDate asOf) {
        NhlSeason current = NhlSeason.containing(asOf);
        List<HeadToHeadEntry> meetings = new ArrayList<>();
        for (NhlSeason season : List.of(current, current.previous())) {
            fetchCache.getTeamGames(team, season).stream()
                    .filter(g -> opponent.equals(g.opponent()))
                    .filter(g -> g.date().isBefore(asOf))
                    .map(g -> new HeadToHeadEntry(g.date(), g.goalsFor(), g.goalsAgainst()))
                    .forEach(meetings::add);
        }
        meetings.sort(Comparator.comparing(HeadToHeadEntry::date).reversed());
        return meetings.size() > depth ? List.copyOf(meetings.subList(0, depth)) : meetings;
    }
}
