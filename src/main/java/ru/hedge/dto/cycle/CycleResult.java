package ru.hedge.dto.cycle;

import lombok.Builder;
import lombok.Value;
import ru.hedge.dto.exchanges.Direction;
import ru.hedge.dto.execution.ExecutionResult;
import ru.hedge.dto.funding.CyclePnl;
import ru.hedge.dto.funding.FundingAnalysis;
import ru.hedge.dto.risk.RiskAssessment;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a single cycle. The orchestrator fills the builder step by step and
 * freezes it once, on whichever path the cycle leaves through.
 */
@Value
@Builder
public class CycleResult {
    String cycleId;
    boolean success;
    @Builder.Default
    CycleState state = CycleState.IDLE;

    @Builder.Default
    String token = "UNKNOWN";
    double equityUsage;
    int leverage;
    int holdDurationSeconds;

    Direction firstSide;
    Direction secondSide;
    double positionSize;
    double positionValue;
    @Builder.Default
    List<String> sizingNotes = List.of();
    RiskAssessment riskAssessment;

    FundingAnalysis fundingAnalysis;
    double fundingEarned;
    CyclePnl pnl;

    ExecutionResult openResult;
    ExecutionResult closeResult;

    Instant startTime;
    Instant endTime;
    double totalDurationSeconds;

    String errorMessage;
}
