package com.hockeyquant.adapter.model;

/**
 * Why an upstream fetch produced no value.
 */
public record FetchError(Kind kind, String message) {

    public enum Kind {
        /** Network failure or non-2xx response */
        UNAVAILABLE,
        /** Upstream did not answer within the configured response timeout */
        TIMEOUT,
        /** Payload arrived but could not be parsed into the expected shape */
        MALFORMED
    }

    public static FetchError unavailable(String message) {
        return new FetchError(Kind.UNAVAILABLE, message);
    }

    public static FetchError timeout(String message) {
        return new FetchError(Kind.TIMEOUT, message);
    }

    public static FetchError malformed(String message) {
        return new FetchError(Kind.MALFORMED, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
