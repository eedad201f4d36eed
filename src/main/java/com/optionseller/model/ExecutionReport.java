package com.optionseller.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Final outcome of a fired job.
 */
@Value
@Builder
public class ExecutionReport {
    String jobId;
    ExecutionState finalState;
    MatchResult matchResult;
    @Singular
    List<LegOrderResult> legResults;
    String errorMessage;

    public boolean isMatched() {
        return matchResult != null && matchResult.isMatched();
    }
}
