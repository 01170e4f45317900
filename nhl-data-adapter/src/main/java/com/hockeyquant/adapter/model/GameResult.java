package com.hockeyquant.adapter.model;

public enum GameResult {
    WIN,
    LOSS,
    /** Lost after regulation (overtime or shootout) */
    OT_LOSS
}
