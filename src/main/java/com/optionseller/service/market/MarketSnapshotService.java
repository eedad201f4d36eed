package com.optionseller.service.market;

import com.optionseller.config.SellerConfig;
import com.optionseller.model.InstrumentUniverse;
import com.optionseller.model.MarketSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the instrument universe and the ad hoc "current" snapshot.
 * <p>
 * The universe is loaded once (lazily, or at startup when {@code seller.preload-universe}
 * is set) and never changes afterwards. Scheduled jobs build their own snapshot through
 * {@link #buildFreshSnapshot()}; only ad hoc refreshes replace the shared slot.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarketSnapshotService {

    private final InstrumentUniverseLoader universeLoader;
    private final QuoteFetcher quoteFetcher;
    private final MarketSnapshotBuilder snapshotBuilder;
    private final SellerConfig sellerConfig;
    private final Clock marketClock;

    private volatile InstrumentUniverse universe;
    private final ReentrantLock universeLock = new ReentrantLock();

    private final AtomicReference<MarketSnapshot> currentSnapshot = new AtomicReference<>();

    @EventListener(ApplicationReadyEvent.class)
    public void preloadUniverse() {
        if (!sellerConfig.isPreloadUniverse()) {
            return;
        }
        try {
            getUniverse();
        } catch (RuntimeException e) {
            log.error("Failed to preload {} instrument universe, will retry on first use: {}",
                    sellerConfig.getUnderlying(), e.getMessage(), e);
        }
    }

    public InstrumentUniverse getUniverse() {
        InstrumentUniverse loaded = universe;
        if (loaded != null) {
            return loaded;
        }
        universeLock.lock();
        try {
            // Double-check after acquiring lock
            if (universe == null) {
                log.info("Loading instrument universe for {}", sellerConfig.getUnderlying());
                universe = universeLoader.loadInstrumentUniverse(sellerConfig.getUnderlying());
            }
            return universe;
        } finally {
            universeLock.unlock();
        }
    }

    public double fetchReferencePrice() {
        return quoteFetcher.getLastPrice(sellerConfig.getReferenceExchange(), sellerConfig.getReferenceSymbol());
    }

    /**
     * Builds a snapshot from a freshly fetched reference price without touching the shared slot.
     */
    public MarketSnapshot buildFreshSnapshot() {
        InstrumentUniverse loaded = getUniverse();
        double referencePrice = fetchReferencePrice();
        return snapshotBuilder.build(referencePrice, loaded, marketClock.instant());
    }

    /**
     * Rebuilds the shared snapshot and swaps it in as a whole.
     */
    public MarketSnapshot refreshCurrent() {
        MarketSnapshot snapshot = buildFreshSnapshot();
        currentSnapshot.set(snapshot);
        log.info("Current snapshot refreshed: ref={} ATM={} calls={} puts={}",
                snapshot.referencePrice(), snapshot.atmStrike(),
                snapshot.callCandidates().size(), snapshot.putCandidates().size());
        return snapshot;
    }

    public Optional<MarketSnapshot> current() {
        return Optional.ofNullable(currentSnapshot.get());
    }
}
