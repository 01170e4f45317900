package com.hockeyquant.adapter.model;

public enum Division {
    ATLANTIC(Conference.EASTERN),
    METROPOLITAN(Conference.EASTERN),
    CENTRAL(Conference.WESTERN),
    PACIFIC(Conference.WESTERN);

    private final Conference conference;

    Division(Conference conference) {
        this.conference = conference;
    }

    public Conference getConference() {
        return conference;
    }
}
