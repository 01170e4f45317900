package com.hockeyquant.adapter.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.hockeyquant.adapter.model.FetchError;

import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions thrown by the clients to {@link FetchError} kinds.
 */
final class FetchErrors {

    private FetchErrors() {
    }

    static FetchError classify(String what, Throwable error) {
        String message = what + ": " + error.getMessage();
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof io.netty.handler.timeout.TimeoutException) {
                return FetchError.timeout(message);
            }
            if (t instanceof JsonProcessingException
                    || t instanceof MalformedPayloadException
                    || t instanceof MoneyPuckCsvParser.MalformedCsvException
                    || t instanceof NumberFormatException) {
                return FetchError.malformed(message);
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return FetchError.unavailable(message);
    }
}
