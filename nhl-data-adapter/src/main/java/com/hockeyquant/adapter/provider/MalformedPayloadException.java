package com.hockeyquant.adapter.provider;

/**
 * An upstream JSON payload is missing the structure a provider relies on.
 */
public class MalformedPayloadException extends RuntimeException {
    public MalformedPayloadException(String message) {
        super(message);
    }
}
