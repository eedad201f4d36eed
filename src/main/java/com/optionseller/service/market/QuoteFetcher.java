package com.optionseller.service.market;

import com.optionseller.exception.QuoteUnavailableException;
import com.optionseller.model.OptionInstrument;

import java.util.List;

/**
 * Last traded price lookups.
 */
public interface QuoteFetcher {

    /**
     * @throws QuoteUnavailableException when the broker call fails or returns no quote
     */
    double getLastPrice(String exchange, String symbol);

    /**
     * Batch lookup in a single broker call. The returned prices are in the same order as
     * {@code instruments}; if any one quote is missing the whole call fails.
     *
     * @throws QuoteUnavailableException when the broker call fails or any quote is missing
     */
    List<Double> getLastPrices(List<OptionInstrument> instruments);
}
