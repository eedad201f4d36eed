package com.optionseller.model;

import java.time.Instant;

/**
 * Progress event for one job, published through the Spring application event bus.
 */
public record ExecutionEvent(
    String jobId,
    ExecutionEventType type,
    ExecutionState state,
    String message,
    Instant timestamp
) {
}
