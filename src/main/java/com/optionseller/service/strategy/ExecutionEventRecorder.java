package com.optionseller.service.strategy;

import com.optionseller.config.SellerConfig;
import com.optionseller.model.ExecutionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Logs every execution event and keeps the most recent ones for the REST surface.
 */
@Component
@Slf4j
public class ExecutionEventRecorder {

    private final int capacity;
    private final Deque<ExecutionEvent> recent = new ArrayDeque<>();

    public ExecutionEventRecorder(SellerConfig sellerConfig) {
        this.capacity = Math.max(1, sellerConfig.getEventHistorySize());
    }

    @EventListener
    public void onExecutionEvent(ExecutionEvent event) {
        switch (event.type()) {
            case FAILED, ORDER_FAILED -> log.warn("[{}] {} ({}): {}", event.jobId(), event.type(), event.state(), event.message());
            case NEAR_MATCH, SNAPSHOT_BUILT, QUOTES_FETCHED -> log.debug("[{}] {}: {}", event.jobId(), event.type(), event.message());
            default -> log.info("[{}] {} ({}): {}", event.jobId(), event.type(), event.state(), event.message());
        }
        synchronized (recent) {
            if (recent.size() == capacity) {
                recent.removeFirst();
            }
            recent.addLast(event);
        }
    }

    public List<ExecutionEvent> getRecentEvents() {
        synchronized (recent) {
            return List.copyOf(recent);
        }
    }

    public List<ExecutionEvent> getRecentEvents(String jobId) {
        return getRecentEvents().stream()
                .filter(e -> e.jobId().equals(jobId))
                .toList();
    }
}
