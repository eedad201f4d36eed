package com.optionseller.model;

import java.time.Instant;
import java.util.List;

/**
 * Market context for one matching pass: the ATM strike and the OTM call and put
 * candidates around it. Never edited in place; a refresh builds a new one.
 */
public record MarketSnapshot(
    double referencePrice,
    double atmStrike,
    double strikeSpacing,
    List<OptionInstrument> callCandidates,
    List<OptionInstrument> putCandidates,
    Instant builtAt
) {

    public MarketSnapshot {
        callCandidates = List.copyOf(callCandidates);
        putCandidates = List.copyOf(putCandidates);
    }
}
