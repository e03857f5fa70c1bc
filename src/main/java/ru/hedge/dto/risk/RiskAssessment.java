package ru.hedge.dto.risk;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RiskAssessment {
    List<RiskCheckResult> checks;
    boolean overallPassed;
    RiskLevel overallRisk;
    List<String> blockingIssues;
    List<String> warnings;

    public boolean canProceed() {
        return overallPassed && overallRisk != RiskLevel.CRITICAL;
    }
}
