package com.optionseller.exception;

import java.time.Instant;

/**
 * Thrown when a sell job is requested for an instant that is not in the future.
 */
public class InvalidTimeException extends RuntimeException {

    private final Instant requestedAt;

    public InvalidTimeException(Instant requestedAt, Instant now) {
        super("Must enter a future time: requested " + requestedAt + " is not after " + now);
        this.requestedAt = requestedAt;
    }

    public InvalidTimeException(String message) {
        super(message);
        this.requestedAt = null;
    }

    public Instant getRequestedAt() {
        return requestedAt;
    }
}
