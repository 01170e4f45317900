package com.hockeyquant.adapter.model;

/**
 * How two clubs relate in the league structure, and how many recent meetings
 * are worth looking back over for each relationship.
 */
public enum TeamRelationship {
    SAME_DIVISION(8),
    SAME_CONFERENCE(6),
    DIFFERENT_CONFERENCE(4);

    private final int headToHeadDepth;

    TeamRelationship(int headToHeadDepth) {
        this.headToHeadDepth = headToHeadDepth;
    }

    public int getHeadToHeadDepth() {
        return headToHeadDepth;
    }

    public static TeamRelationship between(String team, String opponent) {
        NhlTeam a = NhlTeam.fromAbbrev(team).orElse(null);
        NhlTeam b = NhlTeam.fromAbbrev(opponent).orElse(null);
        if (a == null || b == null) {
            return DIFFERENT_CONFERENCE;
        }
        if (a.getDivision() == b.getDivision()) {
            return SAME_DIVISION;
        }
        if (a.getConference() == b.getConference()) {
            return SAME_CONFERENCE;
        }
        return DIFFERENT_CONFERENCE;
    }
}
