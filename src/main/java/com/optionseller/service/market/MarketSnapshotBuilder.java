package com.optionseller.service.market;

import com.optionseller.config.SellerConfig;
import com.optionseller.model.InstrumentUniverse;
import com.optionseller.model.MarketSnapshot;
import com.optionseller.model.OptionInstrument;
import com.optionseller.model.OptionType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Derives the ATM strike and the OTM call/put candidates from a reference price.
 * Stateless; every call returns a new snapshot.
 */
@Component
@RequiredArgsConstructor
public class MarketSnapshotBuilder {

    private final SellerConfig sellerConfig;

    /**
     * Nearest multiple of {@code strikeSpacing} to {@code referencePrice}. Ties round to the
     * even multiple, e.g. 17825 with spacing 50 gives 17800.
     */
    public static double atmStrike(double referencePrice, double strikeSpacing) {
        return Math.rint(referencePrice / strikeSpacing) * strikeSpacing;
    }

    public MarketSnapshot build(double referencePrice, InstrumentUniverse universe, Instant builtAt) {
        double spacing = universe.strikeSpacing();
        double atm = atmStrike(referencePrice, spacing);
        double low = atm - spacing * sellerConfig.getStrikeWindow();
        double high = atm + spacing * sellerConfig.getStrikeWindow();

        List<OptionInstrument> window = universe.instruments().stream()
                .filter(i -> i.strike() >= low && i.strike() <= high)
                .toList();

        List<OptionInstrument> calls = window.stream()
                .filter(i -> i.optionType() == OptionType.CALL && i.strike() > atm)
                .toList();
        List<OptionInstrument> puts = window.stream()
                .filter(i -> i.optionType() == OptionType.PUT && i.strike() < atm)
                .toList();

        return new MarketSnapshot(referencePrice, atm, spacing, calls, puts, builtAt);
    }
}
