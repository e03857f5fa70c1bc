package ru.hedge.dto.execution;

import lombok.Builder;
import lombok.Value;

/**
 * Result of opening or closing both legs. Both leg results are always present.
 */
@Value
@Builder
public class ExecutionResult {
    boolean success;
    ExecutionState state;
    LegResult firstLeg;
    LegResult secondLeg;
    long executionTimeMs;
    String errorMessage;
    boolean rollbackPerformed;
    boolean rollbackSuccess;

    /**
     * True when a compensating close was needed and did not go through.
     */
    public boolean isUnhedgedExposure() {
        return rollbackPerformed && !rollbackSuccess;
    }
}
