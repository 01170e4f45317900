package com.hockeyquant.prediction.multiplier;

import com.hockeyquant.adapter.model.SeasonTables;
import com.hockeyquant.adapter.model.SpecialTeamsRecord;
import com.hockeyquant.prediction.cache.SeasonStatsCache;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Power-play and penalty-kill matchup edge, kept within [0.95, 1.05].
 */
@Component
public class SpecialTeamsCalculator {

    static final double COEFFICIENT = 0.015;
    static final double MIN = 0.95;
    static final double MAX = 1.05;

    private final SeasonStatsCache statsCache;

    public SpecialTeamsCalculator(SeasonStatsCache statsCache) {
        this.statsCache = statsCache;
    }

    public Multiplier calculate(String team, String opponent) {
        SeasonTables tables = statsCache.get();
        Optional<SpecialTeamsRecord> teamSt = tables.specialTeams(team);
        Optional<SpecialTeamsRecord> oppSt = tables.specialTeams(opponent);
        if (teamSt.isEmpty() || oppSt.isEmpty()) {
            return Multiplier.neutral("No ST data");
        }
        return calculate(teamSt.get(), oppSt.get());
    }

    Multiplier calculate(SpecialTeamsRecord team, SpecialTeamsRecord opp) {
        // Power play against how often the opponent's kill fails, over the opponent's kills per game
        double ppEdge = team.powerPlayPct() - (1 - opp.penaltyKillPct());
        double ppImpact = ppEdge * opp.penaltyKillsPerGame();

        // Kill rate against how often the opponent's power play fails, over our own kills per game
        double pkEdge = team.penaltyKillPct() - (1 - opp.powerPlayPct());
        double pkImpact = pkEdge * team.penaltyKillsPerGame();

        double mult = Multiplier.clamp(1.0 + (ppImpact + pkImpact) * COEFFICIENT, MIN, MAX);

        List<String> reasons = new ArrayList<>();
        if (team.powerPlayPct() > 0.22 || team.powerPlayPct() < 0.17) {
            reasons.add(String.format(Locale.ROOT, "PP %.0f%%", team.powerPlayPct() * 100));
        }
        if (opp.penaltyKillPct() < 0.78 || opp.penaltyKillPct() > 0.82) {
            reasons.add(String.format(Locale.ROOT, "vs PK %.0f%%", opp.penaltyKillPct() * 100));
        }
        return new Multiplier(mult, reasons.isEmpty() ? "Neutral ST" : String.join(", ", reasons));
    }
}
