package com.optionseller.service.strategy;

import com.optionseller.config.SellerConfig;
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
import com.optionseller.support.TestInstruments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SellExecutionSequencer.
 * Broker collaborators are mocked; matching runs for real.
 */
@ExtendWith(MockitoExtension.class)
class SellExecutionSequencerTest {

    private static final Instant NOW = Instant.parse("2024-01-18T04:00:00Z");

    @Mock
    private MarketSnapshotService marketSnapshotService;

    @Mock
    private QuoteFetcher quoteFetcher;

    @Mock
    private OrderSubmitter orderSubmitter;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private SellerConfig sellerConfig;
    private SellExecutionSequencer sequencer;

    private final OptionInstrument call17900 = TestInstruments.call(17900);
    private final OptionInstrument call17950 = TestInstruments.call(17950);
    private final OptionInstrument call18000 = TestInstruments.call(18000);
    private final OptionInstrument put17750 = TestInstruments.put(17750);
    private final OptionInstrument put17700 = TestInstruments.put(17700);

    private MarketSnapshot snapshot;

    @BeforeEach
    void setUp() {
        sellerConfig = new SellerConfig();
        Clock clock = Clock.fixed(NOW, ZoneId.of("Asia/Kolkata"));
        sequencer = new SellExecutionSequencer(marketSnapshotService, quoteFetcher, new StrikeMatcher(),
                orderSubmitter, sellerConfig, eventPublisher, clock);

        snapshot = new MarketSnapshot(17832, 17850, 50,
                List.of(call17900, call17950, call18000),
                List.of(put17750, put17700),
                NOW);
    }

    private void stubMarket() {
        when(marketSnapshotService.buildFreshSnapshot()).thenReturn(snapshot);
        when(quoteFetcher.getLastPrices(snapshot.callCandidates())).thenReturn(List.of(92.0, 101.0, 115.0));
        when(quoteFetcher.getLastPrices(snapshot.putCandidates())).thenReturn(List.of(98.0, 105.0));
    }

    private ScheduledSellJob job(double targetPrice) {
        return new ScheduledSellJob("job-1", targetPrice, NOW.plusSeconds(60), NOW);
    }

    private List<ExecutionEventType> publishedTypes() {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, atLeastOnce()).publishEvent(captor.capture());
        return captor.getAllValues().stream()
                .map(e -> ((ExecutionEvent) e).type())
                .toList();
    }

    @Test
    @DisplayName("Should sell both matched legs with lot-sized quantity and 20% stop-loss")
    void shouldPlaceBothLegsOnMatch() {
        stubMarket();
        when(orderSubmitter.placeSellOrder(anyString(), anyInt(), anyDouble())).thenReturn("ord-ce", "ord-pe");

        ScheduledSellJob job = job(100);
        ExecutionReport report = sequencer.execute(job);

        InOrder inOrder = inOrder(orderSubmitter);
        inOrder.verify(orderSubmitter).placeSellOrder(call17900.tradingSymbol(), 50, 18.4);
        inOrder.verify(orderSubmitter).placeSellOrder(put17750.tradingSymbol(), 50, 19.6);

        assertEquals(ExecutionState.DONE, report.getFinalState());
        assertTrue(report.isMatched());
        assertEquals(new QuotedStrike(17900, 92), report.getMatchResult().getCall().orElseThrow());
        assertEquals(new QuotedStrike(17750, 98), report.getMatchResult().getPut().orElseThrow());
        assertEquals(List.of("ord-ce", "ord-pe"), report.getLegResults().stream().map(LegOrderResult::orderId).toList());
        assertEquals(ExecutionState.DONE, job.getState());
        assertSame(report, job.getReport());

        List<ExecutionEventType> types = publishedTypes();
        assertEquals(ExecutionEventType.REFRESH_STARTED, types.get(0));
        assertTrue(types.contains(ExecutionEventType.MATCH_FOUND));
        assertEquals(2, types.stream().filter(t -> t == ExecutionEventType.ORDER_PLACED).count());
        assertEquals(ExecutionEventType.COMPLETED, types.get(types.size() - 1));
    }

    @Test
    @DisplayName("Should still attempt the put leg when the call leg is rejected")
    void shouldAttemptPutAfterCallRejection() {
        stubMarket();
        when(orderSubmitter.placeSellOrder(eq(call17900.tradingSymbol()), anyInt(), anyDouble()))
                .thenThrow(new OrderRejectedException(call17900.tradingSymbol(), "Insufficient margin"));
        when(orderSubmitter.placeSellOrder(eq(put17750.tradingSymbol()), anyInt(), anyDouble()))
                .thenReturn("ord-pe");

        ExecutionReport report = sequencer.execute(job(100));

        verify(orderSubmitter).placeSellOrder(eq(put17750.tradingSymbol()), eq(50), anyDouble());
        assertEquals(ExecutionState.DONE, report.getFinalState());

        LegOrderResult callLeg = report.getLegResults().get(0);
        LegOrderResult putLeg = report.getLegResults().get(1);
        assertEquals(OptionType.CALL, callLeg.leg());
        assertFalse(callLeg.isPlaced());
        assertEquals("Insufficient margin", callLeg.failureReason());
        assertEquals(OptionType.PUT, putLeg.leg());
        assertTrue(putLeg.isPlaced());
        assertEquals("ord-pe", putLeg.orderId());

        List<ExecutionEventType> types = publishedTypes();
        assertTrue(types.contains(ExecutionEventType.ORDER_FAILED));
        assertTrue(types.contains(ExecutionEventType.ORDER_PLACED));
    }

    @Test
    @DisplayName("Should send and record the same tick-aligned stop-loss")
    void shouldRecordTriggerActuallySent() {
        when(marketSnapshotService.buildFreshSnapshot()).thenReturn(snapshot);
        when(quoteFetcher.getLastPrices(snapshot.callCandidates())).thenReturn(List.of(101.3, 115.0, 120.0));
        when(quoteFetcher.getLastPrices(snapshot.putCandidates())).thenReturn(List.of(98.0, 105.0));
        when(orderSubmitter.placeSellOrder(anyString(), anyInt(), anyDouble())).thenReturn("ord-ce", "ord-pe");

        ExecutionReport report = sequencer.execute(job(100));

        verify(orderSubmitter).placeSellOrder(call17900.tradingSymbol(), 50, 20.25);
        verify(orderSubmitter).placeSellOrder(put17750.tradingSymbol(), 50, 19.6);
        assertEquals(20.25, report.getLegResults().get(0).stopLossPrice());
        assertEquals(19.6, report.getLegResults().get(1).stopLossPrice());

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, atLeastOnce()).publishEvent(captor.capture());
        ExecutionEvent callPlaced = captor.getAllValues().stream()
                .map(ExecutionEvent.class::cast)
                .filter(e -> e.type() == ExecutionEventType.ORDER_PLACED)
                .findFirst()
                .orElseThrow();
        assertTrue(callPlaced.message().contains("trigger 20.25"), callPlaced.message());
    }

    @Test
    @DisplayName("Should skip a leg whose stop-loss rounds below one tick")
    void shouldSkipSubTickStopLoss() {
        when(marketSnapshotService.buildFreshSnapshot()).thenReturn(snapshot);
        when(quoteFetcher.getLastPrices(snapshot.callCandidates())).thenReturn(List.of(0.1, 0.08, 0.05));
        when(quoteFetcher.getLastPrices(snapshot.putCandidates())).thenReturn(List.of(0.1, 0.12));

        ExecutionReport report = sequencer.execute(job(0.1));

        verifyNoInteractions(orderSubmitter);
        assertEquals(ExecutionState.DONE, report.getFinalState());
        assertEquals(2, report.getLegResults().size());
        report.getLegResults().forEach(leg -> {
            assertFalse(leg.isPlaced());
            assertEquals(0.0, leg.stopLossPrice());
        });
        assertEquals(2, publishedTypes().stream().filter(t -> t == ExecutionEventType.ORDER_FAILED).count());
    }

    @Test
    @DisplayName("Should end in ERROR when a matched strike is not among the candidates")
    void shouldFailWhenMatchedStrikeHasNoInstrument() {
        StrikeMatcher strikeMatcher = mock(StrikeMatcher.class);
        SellExecutionSequencer mismatched = new SellExecutionSequencer(marketSnapshotService, quoteFetcher,
                strikeMatcher, orderSubmitter, sellerConfig, eventPublisher, Clock.fixed(NOW, ZoneId.of("Asia/Kolkata")));
        stubMarket();
        when(strikeMatcher.matchAtPrice(anyDouble(), anyList(), anyList(), anyDouble()))
                .thenReturn(MatchResult.matched(new QuotedStrike(18050, 92), new QuotedStrike(17750, 98)));

        ScheduledSellJob job = job(100);
        ExecutionReport report = mismatched.execute(job);

        assertEquals(ExecutionState.ERROR, report.getFinalState());
        assertEquals(ExecutionState.ERROR, job.getState());
        assertTrue(report.getErrorMessage().contains("18050"), report.getErrorMessage());
        assertTrue(report.getLegResults().isEmpty());
        verifyNoInteractions(orderSubmitter);

        List<ExecutionEventType> types = publishedTypes();
        assertTrue(types.contains(ExecutionEventType.MATCH_FOUND));
        assertEquals(ExecutionEventType.FAILED, types.get(types.size() - 1));
    }

    @Test
    @DisplayName("Should multiply lot size by configured lots")
    void shouldUseConfiguredLots() {
        sellerConfig.setLots(3);
        stubMarket();
        when(orderSubmitter.placeSellOrder(anyString(), anyInt(), anyDouble())).thenReturn("ord");

        sequencer.execute(job(100));

        verify(orderSubmitter, times(2)).placeSellOrder(anyString(), eq(150), anyDouble());
    }

    @Test
    @DisplayName("Should report similar-price pairs and place no orders when nothing trades near target")
    void shouldReportNearMatchesWithoutOrders() {
        stubMarket();

        ExecutionReport report = sequencer.execute(job(1000));

        verifyNoInteractions(orderSubmitter);
        assertEquals(ExecutionState.DONE, report.getFinalState());
        assertFalse(report.isMatched());

        List<SimilarPair> nearMatches = report.getMatchResult().getNearMatches();
        assertEquals(2, nearMatches.size());
        assertEquals(new SimilarPair(200, new QuotedStrike(17950, 101), new QuotedStrike(17750, 98)), nearMatches.get(0));
        assertEquals(250.0, nearMatches.get(1).strikeDistance());

        List<ExecutionEventType> types = publishedTypes();
        assertTrue(types.contains(ExecutionEventType.NO_MATCH));
        assertEquals(2, types.stream().filter(t -> t == ExecutionEventType.NEAR_MATCH).count());
        assertFalse(types.contains(ExecutionEventType.MATCH_FOUND));
    }

    @Test
    @DisplayName("Should end in ERROR when the reference price cannot be fetched")
    void shouldFailOnRefreshError() {
        when(marketSnapshotService.buildFreshSnapshot()).thenThrow(new QuoteUnavailableException("Kite API error [503]: down"));

        ScheduledSellJob job = job(100);
        ExecutionReport report = sequencer.execute(job);

        assertEquals(ExecutionState.ERROR, report.getFinalState());
        assertEquals(ExecutionState.ERROR, job.getState());
        assertTrue(report.getErrorMessage().contains("503"));
        verifyNoInteractions(quoteFetcher, orderSubmitter);
        assertTrue(publishedTypes().contains(ExecutionEventType.FAILED));
    }

    @Test
    @DisplayName("Should end in ERROR when option quotes cannot be fetched")
    void shouldFailOnQuoteError() {
        when(marketSnapshotService.buildFreshSnapshot()).thenReturn(snapshot);
        when(quoteFetcher.getLastPrices(snapshot.callCandidates()))
                .thenThrow(new QuoteUnavailableException("No LTP returned for NFO:X"));

        ExecutionReport report = sequencer.execute(job(100));

        assertEquals(ExecutionState.ERROR, report.getFinalState());
        assertTrue(report.getLegResults().isEmpty());
        verifyNoInteractions(orderSubmitter);
    }

    @Test
    @DisplayName("Should contain unexpected failures inside the job")
    void shouldContainUnexpectedErrors() {
        when(marketSnapshotService.buildFreshSnapshot()).thenThrow(new IllegalStateException("No NIFTY options expiring"));

        ExecutionReport report = assertDoesNotThrow(() -> sequencer.execute(job(100)));

        assertEquals(ExecutionState.ERROR, report.getFinalState());
        assertTrue(report.getErrorMessage().contains("No NIFTY options expiring"));
    }
}
