package com.hockeyquant.adapter.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Game-state splits published in the team season tables.
 */
public enum Situation {
    ALL("all"),
    POWER_PLAY("5on4"),
    PENALTY_KILL("4on5");

    private final String code;

    Situation(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<Situation> fromCode(String code) {
        return Arrays.stream(values()).filter(s -> s.code.equals(code)).findFirst();
    }
}
