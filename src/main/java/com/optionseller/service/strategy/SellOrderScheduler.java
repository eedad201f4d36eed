package com.optionseller.service.strategy;

import com.optionseller.exception.InvalidTimeException;
import com.optionseller.model.ExecutionEvent;
import com.optionseller.model.ExecutionEventType;
import com.optionseller.model.ExecutionState;
import com.optionseller.model.ScheduledSellJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Arms one-shot sell jobs for a wall-clock instant.
 * <p>
 * The task scheduler only keeps time; when a timer fires the job is handed to the
 * execution pool so a slow broker round trip in one job never delays another job's
 * timer. Jobs cannot be cancelled and are kept in memory only.
 */
@Component
@Slf4j
public class SellOrderScheduler {

    private final TaskScheduler taskScheduler;
    private final ExecutorService executionExecutor;
    private final SellExecutionSequencer sequencer;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock marketClock;

    private final Map<String, ScheduledSellJob> jobs = new ConcurrentHashMap<>();

    public SellOrderScheduler(@Qualifier("sellTaskScheduler") TaskScheduler taskScheduler,
                              @Qualifier("sellExecutionExecutor") ExecutorService executionExecutor,
                              SellExecutionSequencer sequencer,
                              ApplicationEventPublisher eventPublisher,
                              Clock marketClock) {
        this.taskScheduler = taskScheduler;
        this.executionExecutor = executionExecutor;
        this.sequencer = sequencer;
        this.eventPublisher = eventPublisher;
        this.marketClock = marketClock;
    }

    /**
     * Arms a sell job for {@code fireAt}.
     *
     * @throws InvalidTimeException     if {@code fireAt} is not strictly in the future
     * @throws IllegalArgumentException if {@code targetPrice} is not positive
     */
    public ScheduledSellJob requestSchedule(double targetPrice, Instant fireAt) {
        if (!(targetPrice > 0)) {
            throw new IllegalArgumentException("Target price must be positive, got " + targetPrice);
        }
        Instant now = marketClock.instant();
        requireFuture(fireAt, now);
        ScheduledSellJob job = new ScheduledSellJob(UUID.randomUUID().toString(), targetPrice, fireAt, now);

        // ARMED goes out before the timer exists
        jobs.put(job.getJobId(), job);
        String message = String.format("Sell at %.2f armed for %s (in %ds)",
                targetPrice, fireAt.atZone(marketClock.getZone()).toLocalTime(),
                Duration.between(now, fireAt).toSeconds());
        log.info("[{}] {}", job.getJobId(), message);
        eventPublisher.publishEvent(new ExecutionEvent(job.getJobId(), ExecutionEventType.ARMED,
                ExecutionState.ARMED, message, now));

        try {
            job.setFuture(taskScheduler.schedule(() -> handOff(() -> sequencer.execute(job)), fireAt));
        } catch (RuntimeException e) {
            jobs.remove(job.getJobId());
            throw e;
        }
        return job;
    }

    /**
     * Runs {@code action} once, at or after {@code fireAt}, on the execution pool.
     *
     * @throws InvalidTimeException if {@code fireAt} is not strictly in the future
     */
    public ScheduledFuture<?> scheduleAt(Instant fireAt, Runnable action) {
        requireFuture(fireAt, marketClock.instant());
        return taskScheduler.schedule(() -> handOff(action), fireAt);
    }

    private static void requireFuture(Instant fireAt, Instant now) {
        if (fireAt == null) {
            throw new InvalidTimeException("Fire time is required");
        }
        if (!fireAt.isAfter(now)) {
            throw new InvalidTimeException(fireAt, now);
        }
    }

    private void handOff(Runnable action) {
        try {
            executionExecutor.execute(() -> {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    log.error("Scheduled action failed: {}", e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Execution pool rejected a fired job (shutting down?): {}", e.getMessage());
        }
    }

    public Optional<ScheduledSellJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public List<ScheduledSellJob> getJobs() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(ScheduledSellJob::getFireAt))
                .toList();
    }

}
