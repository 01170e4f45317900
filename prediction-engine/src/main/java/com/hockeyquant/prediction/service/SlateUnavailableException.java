package com.hockeyquant.prediction.service;

import com.hockeyquant.adapter.model.FetchError;

import java.time.LocalDate;

/**
 * The list of games for a date could not be fetched, so there is no slate to analyze.
 */
public class SlateUnavailableException extends RuntimeException {

    private final LocalDate date;
    private final FetchError error;

    public SlateUnavailableException(LocalDate date, FetchError error) {
        super("Game list unavailable for " + date + ": " + error);
        this.date = date;
        this.error = error;
    }

    public LocalDate getDate() {
        return date;
    }

    public FetchError getError() {
        return error;
    }
}
