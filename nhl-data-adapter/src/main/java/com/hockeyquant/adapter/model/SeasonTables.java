package com.hockeyquant.adapter.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The five season-aggregate tables, indexed for per-team lookups.
 */
public class SeasonTables {

    private final Map<String, TeamStatLine> teamAll;
    private final Map<String, TeamStatLine> teamPowerPlay;
    private final Map<String, TeamStatLine> teamPenaltyKill;
    private final Map<String, List<GoalieProfile>> goaliesByTeam;
    private final Map<String, List<SkaterSeasonLine>> skatersByTeam;

    public SeasonTables(List<TeamStatLine> teamLines, List<GoalieProfile> goalies, List<SkaterSeasonLine> skaters) {
        this.teamAll = bySituation(teamLines, Situation.ALL);
        this.teamPowerPlay = bySituation(teamLines, Situation.POWER_PLAY);
        this.teamPenaltyKill = bySituation(teamLines, Situation.PENALTY_KILL);
        this.goaliesByTeam = goalies.stream()
                .collect(Collectors.groupingBy(GoalieProfile::team, Collectors.toUnmodifiableList()));
        this.skatersByTeam = skaters.stream()
                .collect(Collectors.groupingBy(SkaterSeasonLine::team, Collectors.toUnmodifiableList()));
    }

    public static SeasonTables empty() {
        return new SeasonTables(List.of(), List.of(), List.of());
    }

    private static Map<String, TeamStatLine> bySituation(List<TeamStatLine> lines, Situation situation) {
        return lines.stream()
                .filter(l -> l.situation() == situation)
                .collect(Collectors.toUnmodifiableMap(TeamStatLine::team, l -> l, (first, second) -> first));
    }

    public Optional<TeamStatLine> teamLine(String team) {
        return Optional.ofNullable(teamAll.get(team));
    }

    /**
     * Present only when all three situational rows exist for the team.
     */
    public Optional<SpecialTeamsRecord> specialTeams(String team) {
        TeamStatLine all = teamAll.get(team);
        TeamStatLine pp = teamPowerPlay.get(team);
        TeamStatLine pk = teamPenaltyKill.get(team);
        if (all == null || pp == null || pk == null) {
            return Optional.empty();
        }
        return Optional.of(SpecialTeamsRecord.from(all, pp, pk));
    }

    public List<GoalieProfile> goalies(String team) {
        return goaliesByTeam.getOrDefault(team, List.of());
    }

    public List<SkaterSeasonLine> skaters(String team) {
        return skatersByTeam.getOrDefault(team, List.of());
    }

    public boolean isEmpty() {
        return teamAll.isEmpty() && goaliesByTeam.isEmpty() && skatersByTeam.isEmpty();
    }
}
