package com.hockeyquant.adapter.model;

public enum Venue {
    HOME,
    AWAY
}
