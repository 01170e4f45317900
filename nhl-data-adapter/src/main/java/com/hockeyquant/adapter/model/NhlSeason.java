package com.hockeyquant.adapter.model;

import java.time.LocalDate;
import java.time.Month;

/**
 * An NHL regular season, identified by the calendar year it starts in.
 * Seasons start in October, so January 2026 belongs to the 2025-26 season.
 */
public record NhlSeason(int startYear) {

    public static NhlSeason containing(LocalDate date) {
        int year = date.getMonthValue() >= Month.OCTOBER.getValue() ? date.getYear() : date.getYear() - 1;
        return new NhlSeason(year);
    }

    public NhlSeason previous() {
        return new NhlSeason(startYear - 1);
    }

    /**
     * Season code as used by the NHL web API, e.g. {@code 20252026}.
     */
    public String code() {
        return String.valueOf(startYear) + (startYear + 1);
    }

    @Override
    public String toString() {
        return code();
    }
}
