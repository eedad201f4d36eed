package com.optionseller.service.market;

import com.optionseller.config.SellerConfig;
import com.optionseller.exception.QuoteUnavailableException;
import com.optionseller.model.InstrumentUniverse;
import com.optionseller.model.OptionInstrument;
import com.optionseller.model.OptionType;
import com.optionseller.service.TradingService;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.Instrument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeSet;

/**
 * Builds the instrument universe from Kite's NFO dump: the underlying's CE/PE contracts
 * at the nearest expiry within the configured horizon. Strike spacing is the gap between
 * the two lowest listed strikes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KiteInstrumentUniverseLoader implements InstrumentUniverseLoader {

    private final TradingService tradingService;
    private final SellerConfig sellerConfig;
    private final Clock marketClock;

    @Override
    public InstrumentUniverse loadInstrumentUniverse(String underlyingName) {
        List<Instrument> dump;
        try {
            dump = tradingService.getInstruments(sellerConfig.getInstrumentExchange());
        } catch (KiteException e) {
            throw new QuoteUnavailableException("Kite API error [" + e.code + "] loading instruments: " + e.message, e);
        } catch (IOException e) {
            throw new QuoteUnavailableException("Network error loading instruments: " + e.getMessage(), e);
        }
        if (dump == null || dump.isEmpty()) {
            throw new IllegalStateException("Empty instrument dump for " + sellerConfig.getInstrumentExchange());
        }

        LocalDate today = LocalDate.now(marketClock);
        LocalDate horizon = today.plusMonths(sellerConfig.getExpiryMonthsAhead());

        List<OptionInstrument> options = new ArrayList<>();
        for (Instrument instrument : dump) {
            if (!underlyingName.equals(instrument.name) || instrument.expiry == null) {
                continue;
            }
            OptionType type = OptionType.fromKiteCode(instrument.instrument_type);
            if (type == null) {
                continue;
            }
            // The SDK parses expiry dates at local midnight of the JVM zone
            LocalDate expiry = instrument.expiry.toInstant().atZone(ZoneId.systemDefault()).toLocalDate();
            if (expiry.isBefore(today) || expiry.isAfter(horizon)) {
                continue;
            }
            Double strike = parseStrike(instrument);
            if (strike == null || instrument.lot_size <= 0) {
                continue;
            }
            options.add(new OptionInstrument(instrument.tradingsymbol, instrument.exchange, strike,
                    type, instrument.lot_size, expiry));
        }

        LocalDate nearestExpiry = options.stream()
                .map(OptionInstrument::expiry)
                .min(Comparator.naturalOrder())
                .orElseThrow(() -> new IllegalStateException(
                        "No " + underlyingName + " options expiring between " + today + " and " + horizon));

        List<OptionInstrument> atExpiry = options.stream()
                .filter(o -> o.expiry().equals(nearestExpiry))
                .toList();

        TreeSet<Double> strikes = new TreeSet<>();
        atExpiry.forEach(o -> strikes.add(o.strike()));
        if (strikes.size() < 2) {
            throw new IllegalStateException("Cannot derive strike spacing for " + underlyingName
                    + " " + nearestExpiry + ": " + strikes.size() + " distinct strike(s)");
        }
        double lowest = strikes.first();
        double spacing = strikes.higher(lowest) - lowest;

        log.info("Loaded {} {} options for expiry {} (strike spacing {})",
                atExpiry.size(), underlyingName, nearestExpiry, spacing);
        return new InstrumentUniverse(underlyingName, nearestExpiry, spacing, atExpiry);
    }

    private Double parseStrike(Instrument instrument) {
        if (instrument.strike == null) {
            return null;
        }
        try {
            return Double.parseDouble(instrument.strike);
        } catch (NumberFormatException e) {
            log.debug("Skipping {} with unparseable strike '{}'", instrument.tradingsymbol, instrument.strike);
            return null;
        }
    }
}
