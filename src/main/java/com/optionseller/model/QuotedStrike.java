package com.optionseller.model;

/**
 * Strike and last traded price of one contract at one point in time.
 */
public record QuotedStrike(double strike, double lastPrice) {

    @Override
    public String toString() {
        return "(" + strike + ", " + lastPrice + ")";
    }
}
