package com.optionseller.service.strategy;

import com.optionseller.config.SellerConfig;
import com.optionseller.exception.InstrumentLookupException;
import com.optionseller.exception.OrderRejectedException;
import com.optionseller.exception.QuoteUnavailableException;
import com.optionseller.model.ExecutionEvent;
import com.optionseller.model.ExecutionEventType;
import com.optionseller.model.ExecutionReport;
import com.optionseller.model.ExecutionState;
import com.optionseller.model.LegOrderResult;
import com.optionseller.model.MarketSnapshot;
import com.optionseller.model.MatchResult;
import com.optionseller.model.OptionInstrument;
import com.optionseller.model.OptionType;
import com.optionseller.model.QuotedStrike;
import com.optionseller.model.ScheduledSellJob;
import com.optionseller.model.SimilarPair;
import com.optionseller.service.market.MarketSnapshotService;
import com.optionseller.service.market.QuoteFetcher;
import com.optionseller.service.order.OrderSubmitter;
import com.optionseller.util.PriceUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a fired sell job to completion on the calling thread.
 * <p>
 * Flow: REFRESHING (reference LTP, new snapshot) → MATCHING (one LTP batch per side,
 * match at target price) → EXECUTING (SL-M SELL on call then put) or REPORTING_NO_MATCH
 * (similar-price pairs, no orders) → DONE. Quote and lookup failures end the job in
 * ERROR. Nothing is retried and no exception leaves {@link #execute(ScheduledSellJob)}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SellExecutionSequencer {

    private final MarketSnapshotService marketSnapshotService;
    private final QuoteFetcher quoteFetcher;
    private final StrikeMatcher strikeMatcher;
    private final OrderSubmitter orderSubmitter;
    private final SellerConfig sellerConfig;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock marketClock;

    public ExecutionReport execute(ScheduledSellJob job) {
        String jobId = job.getJobId();
        log.info("[{}] EXECUTING ORDER at target price {}", jobId, job.getTargetPrice());
        ExecutionReport report;
        try {
            transition(job, ExecutionState.REFRESHING, ExecutionEventType.REFRESH_STARTED, "Refreshing data...");
            MarketSnapshot snapshot = marketSnapshotService.buildFreshSnapshot();
            publish(job, ExecutionEventType.SNAPSHOT_BUILT, String.format(
                    "Reference %.2f, ATM %.0f, %d call / %d put candidates",
                    snapshot.referencePrice(), snapshot.atmStrike(),
                    snapshot.callCandidates().size(), snapshot.putCandidates().size()));

            job.transitionTo(ExecutionState.MATCHING);
            List<QuotedStrike> callQuotes = quote(snapshot.callCandidates());
            List<QuotedStrike> putQuotes = quote(snapshot.putCandidates());
            publish(job, ExecutionEventType.QUOTES_FETCHED, "Fetched LTPs, matching against " + job.getTargetPrice());

            MatchResult match = strikeMatcher.matchAtPrice(job.getTargetPrice(), callQuotes, putQuotes,
                    sellerConfig.getMatchTolerance());

            report = match.isMatched()
                    ? executeLegs(job, snapshot, match)
                    : reportNoMatch(job, callQuotes, putQuotes);
        } catch (QuoteUnavailableException | InstrumentLookupException e) {
            log.error("[{}] Job failed: {}", jobId, e.getMessage());
            report = failed(job, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error while executing job: {}", jobId, e.getMessage(), e);
            report = failed(job, "Unexpected error: " + e.getMessage());
        }

        job.complete(report);
        return report;
    }

    private ExecutionReport executeLegs(ScheduledSellJob job, MarketSnapshot snapshot, MatchResult match) {
        QuotedStrike call = match.getCall().orElseThrow();
        QuotedStrike put = match.getPut().orElseThrow();
        publish(job, ExecutionEventType.MATCH_FOUND,
                "strike: " + call.strike() + "CE, ltp: " + call.lastPrice()
                        + " | strike: " + put.strike() + "PE, ltp: " + put.lastPrice());

        OptionInstrument callInstrument = findInstrument(call.strike(), snapshot.callCandidates(), OptionType.CALL);
        OptionInstrument putInstrument = findInstrument(put.strike(), snapshot.putCandidates(), OptionType.PUT);

        job.transitionTo(ExecutionState.EXECUTING);
        List<LegOrderResult> legResults = new ArrayList<>(2);
        legResults.add(placeLeg(job, callInstrument, call));
        legResults.add(placeLeg(job, putInstrument, put));

        long placed = legResults.stream().filter(LegOrderResult::isPlaced).count();
        transition(job, ExecutionState.DONE, ExecutionEventType.COMPLETED, placed + "/2 legs placed");
        return ExecutionReport.builder()
                .jobId(job.getJobId())
                .finalState(ExecutionState.DONE)
                .matchResult(match)
                .legResults(legResults)
                .build();
    }

    private LegOrderResult placeLeg(ScheduledSellJob job, OptionInstrument instrument, QuotedStrike quote) {
        int quantity = sellerConfig.getLots() * instrument.lotSize();
        double stopLoss = PriceUtils.roundToTick(quote.lastPrice() * sellerConfig.getStopLossFraction());
        OptionType leg = instrument.optionType();

        if (!PriceUtils.isAtLeastOneTick(stopLoss)) {
            String reason = "Stop-loss trigger below one tick for ltp " + quote.lastPrice();
            log.warn("[{}] not placing {} leg {}: {}", job.getJobId(), leg, instrument.tradingSymbol(), reason);
            publish(job, ExecutionEventType.ORDER_FAILED, leg + " " + instrument.tradingSymbol() + " skipped: " + reason);
            return LegOrderResult.failed(leg, instrument.tradingSymbol(), quantity, stopLoss, reason);
        }

        log.info("[{}] placing sell order of {} {} qty {} sl {}", job.getJobId(),
                instrument.strike(), leg.getKiteCode(), quantity, stopLoss);
        try {
            String orderId = orderSubmitter.placeSellOrder(instrument.tradingSymbol(), quantity, stopLoss);
            publish(job, ExecutionEventType.ORDER_PLACED, leg + " " + instrument.tradingSymbol()
                    + " order id: " + orderId + ", trigger " + stopLoss);
            return LegOrderResult.placed(leg, instrument.tradingSymbol(), quantity, stopLoss, orderId);
        } catch (OrderRejectedException e) {
            publish(job, ExecutionEventType.ORDER_FAILED, leg + " " + instrument.tradingSymbol() + " rejected: " + e.getReason());
            return LegOrderResult.failed(leg, instrument.tradingSymbol(), quantity, stopLoss, e.getReason());
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error placing {} leg: {}", job.getJobId(), leg, e.getMessage(), e);
            publish(job, ExecutionEventType.ORDER_FAILED, leg + " " + instrument.tradingSymbol() + " failed: " + e.getMessage());
            return LegOrderResult.failed(leg, instrument.tradingSymbol(), quantity, stopLoss, e.getMessage());
        }
    }

    private ExecutionReport reportNoMatch(ScheduledSellJob job, List<QuotedStrike> callQuotes, List<QuotedStrike> putQuotes) {
        transition(job, ExecutionState.REPORTING_NO_MATCH, ExecutionEventType.NO_MATCH,
                "There is no option instrument trading near " + job.getTargetPrice());

        List<SimilarPair> similar = strikeMatcher.matchBySimilarity(callQuotes, putQuotes,
                sellerConfig.getSimilarityTolerance());
        for (int i = 0; i < similar.size(); i++) {
            SimilarPair pair = similar.get(i);
            publish(job, ExecutionEventType.NEAR_MATCH, String.format("%d strike: %.0fCE -> ltp: %.2f, strike: %.0fPE -> ltp: %.2f%s",
                    i, pair.call().strike(), pair.call().lastPrice(), pair.put().strike(), pair.put().lastPrice(),
                    i == 0 ? " (near to ATM)" : ""));
        }

        transition(job, ExecutionState.DONE, ExecutionEventType.COMPLETED,
                "No orders placed, " + similar.size() + " similar-price pair(s) found");
        return ExecutionReport.builder()
                .jobId(job.getJobId())
                .finalState(ExecutionState.DONE)
                .matchResult(MatchResult.noMatch(similar))
                .build();
    }

    private ExecutionReport failed(ScheduledSellJob job, String message) {
        transition(job, ExecutionState.ERROR, ExecutionEventType.FAILED, message);
        return ExecutionReport.builder()
                .jobId(job.getJobId())
                .finalState(ExecutionState.ERROR)
                .matchResult(MatchResult.noMatch())
                .errorMessage(message)
                .build();
    }

    private List<QuotedStrike> quote(List<OptionInstrument> candidates) {
        List<Double> prices = quoteFetcher.getLastPrices(candidates);
        if (prices.size() != candidates.size()) {
            throw new QuoteUnavailableException("Expected " + candidates.size() + " quotes, got " + prices.size());
        }
        List<QuotedStrike> quotes = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            quotes.add(new QuotedStrike(candidates.get(i).strike(), prices.get(i)));
        }
        return quotes;
    }

    private OptionInstrument findInstrument(double strike, List<OptionInstrument> candidates, OptionType type) {
        return candidates.stream()
                .filter(i -> Double.compare(i.strike(), strike) == 0)
                .findFirst()
                .orElseThrow(() -> new InstrumentLookupException(strike, type));
    }

    private void transition(ScheduledSellJob job, ExecutionState state, ExecutionEventType type, String message) {
        job.transitionTo(state);
        publish(job, type, message);
    }

    private void publish(ScheduledSellJob job, ExecutionEventType type, String message) {
        eventPublisher.publishEvent(new ExecutionEvent(job.getJobId(), type, job.getState(), message, marketClock.instant()));
    }
}
