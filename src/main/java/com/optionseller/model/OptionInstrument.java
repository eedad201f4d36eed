package com.optionseller.model;

import java.time.LocalDate;

/**
 * One option contract of the loaded universe.
 */
public record OptionInstrument(
    String tradingSymbol,
    String exchange,
    double strike,
    OptionType optionType,
    int lotSize,
    LocalDate expiry
) {

    public OptionInstrument {
        if (lotSize <= 0) {
            throw new IllegalArgumentException("Lot size must be positive for " + tradingSymbol);
        }
    }

    /**
     * Kite quote key, e.g. {@code NFO:NIFTY24JAN17900CE}.
     */
    public String quoteKey() {
        return exchange + ":" + tradingSymbol;
    }
}
