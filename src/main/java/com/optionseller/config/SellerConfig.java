package com.optionseller.config;

import com.optionseller.service.TradingConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Seller Configuration
 * Defaults for the delayed sell strategy: underlying, strike window, matching tolerances
 * and order sizing.
 */
@Configuration
@ConfigurationProperties(prefix = "seller")
@Data
public class SellerConfig {

    /** Underlying name as it appears in the instrument dump (e.g. NIFTY). */
    private String underlying = "NIFTY";

    /** Exchange the option contracts trade on. */
    private String instrumentExchange = TradingConstants.EXCHANGE_NFO;

    // Reference price source used for the ATM computation
    private String referenceExchange = TradingConstants.EXCHANGE_NSE;
    private String referenceSymbol = "NIFTY 50";

    /** Number of strikes on either side of ATM considered as candidates. */
    private int strikeWindow = 10;

    /** Relative tolerance when matching option LTPs against the target price. */
    private double matchTolerance = 0.10;

    /** Relative tolerance when pairing calls and puts with similar LTPs. */
    private double similarityTolerance = 0.05;

    /** Stop-loss trigger as a fraction of the matched leg price. */
    private double stopLossFraction = 0.20;

    private int lots = 1;

    /** Only expiries within this many months from today are considered. */
    private int expiryMonthsAhead = 2;

    private int schedulerPoolSize = 2;

    private String marketZone = "Asia/Kolkata";

    /** Load the instrument universe at startup instead of on first use. */
    private boolean preloadUniverse = false;

    /** Number of execution events retained in memory. */
    private int eventHistorySize = 200;

    @Bean
    public TaskScheduler sellTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(schedulerPoolSize);
        scheduler.setThreadNamePrefix("sell-timer-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Fired jobs run here, one thread per in-flight job, so a slow broker call
     * never holds back another job's timer.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService sellExecutionExecutor() {
        AtomicInteger counter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "sell-executor-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(threadFactory);
    }

    @Bean
    public Clock marketClock() {
        return Clock.system(ZoneId.of(marketZone));
    }
}
