package com.optionseller.service.strategy;

import com.optionseller.model.MatchResult;
import com.optionseller.model.QuotedStrike;
import com.optionseller.model.SimilarPair;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the call and put to sell for a target premium.
 * <p>
 * "Approximately equal" is relative to the option's own price: with tolerance 0.10 an
 * option trading at 92 accepts targets within 9.2 of it. All sorts are stable so the
 * same quotes always give the same pair.
 */
@Component
public class StrikeMatcher {

    private static final Comparator<QuotedStrike> BY_PRICE = Comparator.comparingDouble(QuotedStrike::lastPrice);
    private static final Comparator<QuotedStrike> BY_STRIKE = Comparator.comparingDouble(QuotedStrike::strike);

    /**
     * Finds the call and put whose LTP is within {@code tolerance} of {@code targetPrice}.
     * Among the survivors the call with the lowest strike and the put with the highest strike
     * win, i.e. the pair closest to ATM from either side.
     *
     * @return a matched result, or {@link MatchResult#noMatch()} when either side has no survivor
     */
    public MatchResult matchAtPrice(double targetPrice, List<QuotedStrike> callQuotes,
                                    List<QuotedStrike> putQuotes, double tolerance) {
        List<QuotedStrike> calls = withinTolerance(targetPrice, sortedByPrice(callQuotes), tolerance);
        List<QuotedStrike> puts = withinTolerance(targetPrice, sortedByPrice(putQuotes), tolerance);

        if (calls.isEmpty() || puts.isEmpty()) {
            return MatchResult.noMatch();
        }

        calls.sort(BY_STRIKE);
        puts.sort(BY_STRIKE.reversed());
        return MatchResult.matched(calls.get(0), puts.get(0));
    }

    /**
     * Pairs every call with every put whose prices differ by less than
     * {@code callPrice * similarityTolerance}, ordered by the distance between the two strikes.
     * The first pair is the one nearest to ATM.
     */
    public List<SimilarPair> matchBySimilarity(List<QuotedStrike> callQuotes, List<QuotedStrike> putQuotes,
                                               double similarityTolerance) {
        List<QuotedStrike> calls = sortedByPrice(callQuotes);
        List<QuotedStrike> puts = sortedByPrice(putQuotes);

        List<SimilarPair> pairs = new ArrayList<>();
        for (QuotedStrike call : calls) {
            double maxDiff = call.lastPrice() * similarityTolerance;
            for (QuotedStrike put : puts) {
                if (Math.abs(put.lastPrice() - call.lastPrice()) < maxDiff) {
                    pairs.add(new SimilarPair(Math.abs(put.strike() - call.strike()), call, put));
                }
            }
        }
        pairs.sort(Comparator.comparingDouble(SimilarPair::strikeDistance));
        return pairs;
    }

    /**
     * Entries of {@code quotes} that the target price falls within tolerance of, in input order.
     */
    List<QuotedStrike> withinTolerance(double targetPrice, List<QuotedStrike> quotes, double tolerance) {
        List<QuotedStrike> survivors = new ArrayList<>();
        for (QuotedStrike quote : quotes) {
            if (Math.abs(targetPrice - quote.lastPrice()) <= quote.lastPrice() * tolerance) {
                survivors.add(quote);
            }
        }
        return survivors;
    }

    private static List<QuotedStrike> sortedByPrice(List<QuotedStrike> quotes) {
        List<QuotedStrike> sorted = new ArrayList<>(quotes);
        sorted.sort(BY_PRICE);
        return sorted;
    }
}
