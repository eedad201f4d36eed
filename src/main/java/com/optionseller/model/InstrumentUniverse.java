package com.optionseller.model;

import java.time.LocalDate;
import java.util.List;

/**
 * All option contracts of one underlying at its nearest expiry.
 * Loaded once and shared read-only between jobs.
 */
public record InstrumentUniverse(
    String underlying,
    LocalDate expiry,
    double strikeSpacing,
    List<OptionInstrument> instruments
) {

    public InstrumentUniverse {
        if (strikeSpacing <= 0) {
            throw new IllegalArgumentException("Strike spacing must be positive, got " + strikeSpacing);
        }
        instruments = List.copyOf(instruments);
    }
}
