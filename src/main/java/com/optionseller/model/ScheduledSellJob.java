package com.optionseller.model;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * A sell request armed for a future instant. Lives in memory only.
 */
@Getter
public class ScheduledSellJob {

    private final String jobId;
    private final double targetPrice;
    private final Instant fireAt;
    private final Instant createdAt;

    private volatile ExecutionState state = ExecutionState.ARMED;
    private volatile ExecutionReport report;

    @Setter
    private volatile ScheduledFuture<?> future;

    public ScheduledSellJob(String jobId, double targetPrice, Instant fireAt, Instant createdAt) {
        this.jobId = jobId;
        this.targetPrice = targetPrice;
        this.fireAt = fireAt;
        this.createdAt = createdAt;
    }

    public void transitionTo(ExecutionState next) {
        this.state = next;
    }

    public void complete(ExecutionReport finalReport) {
        this.report = finalReport;
        this.state = finalReport.getFinalState();
    }
}
