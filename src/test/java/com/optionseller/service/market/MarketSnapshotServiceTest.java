package com.optionseller.service.market;

import com.optionseller.config.SellerConfig;
import com.optionseller.exception.QuoteUnavailableException;
import com.optionseller.model.InstrumentUniverse;
import com.optionseller.model.MarketSnapshot;
import com.optionseller.support.TestInstruments;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MarketSnapshotServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-18T04:00:00Z");

    @Mock
    private InstrumentUniverseLoader universeLoader;

    @Mock
    private QuoteFetcher quoteFetcher;

    private SellerConfig sellerConfig;
    private MarketSnapshotService service;
    private InstrumentUniverse universe;

    @BeforeEach
    void setUp() {
        sellerConfig = new SellerConfig();
        service = new MarketSnapshotService(universeLoader, quoteFetcher, new MarketSnapshotBuilder(sellerConfig),
                sellerConfig, Clock.fixed(NOW, ZoneId.of("Asia/Kolkata")));
        universe = TestInstruments.chain(17000, 18700, 50);
    }

    @Test
    @DisplayName("Should load the universe once and reuse it")
    void shouldLoadUniverseOnce() {
        when(universeLoader.loadInstrumentUniverse("NIFTY")).thenReturn(universe);

        assertSame(universe, service.getUniverse());
        assertSame(universe, service.getUniverse());

        verify(universeLoader, times(1)).loadInstrumentUniverse("NIFTY");
    }

    @Test
    @DisplayName("Should build a fresh snapshot without publishing it as current")
    void shouldBuildWithoutPublishing() {
        when(universeLoader.loadInstrumentUniverse("NIFTY")).thenReturn(universe);
        when(quoteFetcher.getLastPrice("NSE", "NIFTY 50")).thenReturn(17832.0);

        MarketSnapshot snapshot = service.buildFreshSnapshot();

        assertEquals(17850.0, snapshot.atmStrike());
        assertEquals(NOW, snapshot.builtAt());
        assertTrue(service.current().isEmpty());
    }

    @Test
    @DisplayName("Should replace the current snapshot on refresh")
    void shouldReplaceCurrentOnRefresh() {
        when(universeLoader.loadInstrumentUniverse("NIFTY")).thenReturn(universe);
        when(quoteFetcher.getLastPrice("NSE", "NIFTY 50")).thenReturn(17832.0, 18010.0);

        MarketSnapshot first = service.refreshCurrent();
        assertSame(first, service.current().orElseThrow());

        MarketSnapshot second = service.refreshCurrent();
        assertSame(second, service.current().orElseThrow());
        assertEquals(18000.0, second.atmStrike());
    }

    @Test
    @DisplayName("Should keep the previous snapshot when a refresh fails")
    void shouldKeepPreviousOnFailure() {
        when(universeLoader.loadInstrumentUniverse("NIFTY")).thenReturn(universe);
        when(quoteFetcher.getLastPrice("NSE", "NIFTY 50"))
                .thenReturn(17832.0)
                .thenThrow(new QuoteUnavailableException("down"));

        MarketSnapshot first = service.refreshCurrent();

        assertThrows(QuoteUnavailableException.class, () -> service.refreshCurrent());
        assertSame(first, service.current().orElseThrow());
    }

    @Test
    @DisplayName("Should load lazily after a failed preload")
    void shouldRetryAfterFailedPreload() {
        sellerConfig.setPreloadUniverse(true);
        when(universeLoader.loadInstrumentUniverse("NIFTY"))
                .thenThrow(new QuoteUnavailableException("Token expired"))
                .thenReturn(universe);

        assertDoesNotThrow(() -> service.preloadUniverse());
        assertSame(universe, service.getUniverse());
    }

    @Test
    @DisplayName("Should skip preload when disabled")
    void shouldSkipPreloadWhenDisabled() {
        service.preloadUniverse();

        verifyNoInteractions(universeLoader);
    }
}
