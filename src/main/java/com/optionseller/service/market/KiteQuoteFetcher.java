package com.optionseller.service.market;

import com.optionseller.exception.QuoteUnavailableException;
import com.optionseller.model.OptionInstrument;
import com.optionseller.service.TradingService;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.models.LTPQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class KiteQuoteFetcher implements QuoteFetcher {

    private final TradingService tradingService;

    @Override
    public double getLastPrice(String exchange, String symbol) {
        String key = exchange + ":" + symbol;
        Map<String, LTPQuote> ltp = fetch(new String[]{key});
        LTPQuote quote = ltp.get(key);
        if (quote == null) {
            throw new QuoteUnavailableException("No LTP returned for " + key);
        }
        return quote.lastPrice;
    }

    @Override
    public List<Double> getLastPrices(List<OptionInstrument> instruments) {
        if (instruments.isEmpty()) {
            return List.of();
        }

        String[] keys = instruments.stream()
                .map(OptionInstrument::quoteKey)
                .toArray(String[]::new);
        Map<String, LTPQuote> ltp = fetch(keys);

        // Kite returns a map keyed by instrument; rebuild the caller's order from it
        List<Double> prices = new ArrayList<>(keys.length);
        for (String key : keys) {
            LTPQuote quote = ltp.get(key);
            if (quote == null) {
                throw new QuoteUnavailableException("No LTP returned for " + key
                        + " (" + ltp.size() + "/" + keys.length + " quotes received)");
            }
            prices.add(quote.lastPrice);
        }
        return prices;
    }

    private Map<String, LTPQuote> fetch(String[] keys) {
        try {
            Map<String, LTPQuote> ltp = tradingService.getLTP(keys);
            if (ltp == null) {
                throw new QuoteUnavailableException("Kite returned no LTP data for " + keys.length + " instruments");
            }
            return ltp;
        } catch (KiteException e) {
            log.error("Kite LTP request failed [{}]: {}", e.code, e.message);
            throw new QuoteUnavailableException("Kite API error [" + e.code + "]: " + e.message, e);
        } catch (IOException e) {
            log.error("Network error fetching LTP: {}", e.getMessage());
            throw new QuoteUnavailableException("Network error: " + e.getMessage(), e);
        }
    }
}
