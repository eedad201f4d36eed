package com.optionseller.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request to sell a call and a put near {@code targetPrice} at a later time.
 * Either {@code time} (HH:mm or HH:mm:ss today, market time zone) or {@code fireAt} must be given.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleSellRequest {

    @NotNull(message = "Target price is required")
    @Positive(message = "Target price must be positive")
    private Double targetPrice;

    private String time;

    private Instant fireAt;
}
