package com.optionseller.exception;

/**
 * Thrown when last traded prices could not be fetched from the broker.
 */
public class QuoteUnavailableException extends RuntimeException {

    public QuoteUnavailableException(String message) {
        super(message);
    }

    public QuoteUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
