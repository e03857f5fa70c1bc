package ru.hedge.dto.risk;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class RiskCheckResult {
    String checkName;
    boolean passed;
    RiskLevel riskLevel;
    String message;
    @Builder.Default
    Map<String, Object> details = Map.of();
}
