package com.optionseller.dto;

import com.optionseller.model.ExecutionReport;
import com.optionseller.model.ExecutionState;
import com.optionseller.model.ScheduledSellJob;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ScheduledSellResponse {
    private String jobId;
    private double targetPrice;
    private Instant fireAt;
    private Instant createdAt;
    private ExecutionState state;
    private ExecutionReport report;

    public static ScheduledSellResponse from(ScheduledSellJob job) {
        return ScheduledSellResponse.builder()
                .jobId(job.getJobId())
                .targetPrice(job.getTargetPrice())
                .fireAt(job.getFireAt())
                .createdAt(job.getCreatedAt())
                .state(job.getState())
                .report(job.getReport())
                .build();
    }
}
