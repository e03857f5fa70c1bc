package ru.hedge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.hedge.config.HedgeConfig;
import ru.hedge.dto.risk.RiskAssessment;
import ru.hedge.dto.risk.RiskCheckResult;
import ru.hedge.dto.risk.RiskLevel;
import ru.hedge.dto.sizing.BalanceSnapshot;
import ru.hedge.dto.sizing.SizingResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Pre-trade checks. Five independent checks, aggregated into one assessment.
 */
@Slf4j
@Service
public class RiskValidator {

    private static final double MIN_LIQUIDATION_DISTANCE = 0.03;
    private static final double WARN_LIQUIDATION_DISTANCE = 0.05;
    private static final double HIGH_UTILIZATION = 0.9;

    private final HedgeConfig.RiskConfig risk;

    public RiskValidator(HedgeConfig config) {
        this.risk = config.getRisk();
    }

    public RiskAssessment validatePreTrade(SizingResult sizing, BalanceSnapshot first, BalanceSnapshot second,
                                           double price, double maintenanceMarginFirst, double maintenanceMarginSecond) {
        List<RiskCheckResult> checks = List.of(
                checkMinimumBalance(first, second),
                checkPositionLimits(sizing),
                checkMarginSufficiency(sizing, first, second),
                checkLiquidationDistance(sizing.getLeverage(), price, maintenanceMarginFirst, maintenanceMarginSecond),
                checkLeverage(sizing.getLeverage())
        );

        RiskAssessment assessment = aggregate(checks);
        if (assessment.canProceed()) {
            log.info("[Risk] {} passed, overall risk {}{}", sizing.getToken(), assessment.getOverallRisk(),
                    assessment.getWarnings().isEmpty() ? "" : ", warnings: " + assessment.getWarnings());
        } else {
            log.warn("[Risk] {} blocked ({}): {}", sizing.getToken(),
                    assessment.getOverallRisk(), assessment.getBlockingIssues());
        }
        return assessment;
    }

    RiskCheckResult checkMinimumBalance(BalanceSnapshot first, BalanceSnapshot second) {
        double minAvailable = Math.min(first.getAvailable(), second.getAvailable());
        Map<String, Object> details = Map.of(
                "first_available", first.getAvailable(),
                "second_available", second.getAvailable(),
                "minimum_required", risk.getMinBalance());

        if (minAvailable < risk.getMinBalance()) {
            return check("minimum_balance", false, RiskLevel.CRITICAL,
                    String.format("Available balance $%.2f below minimum $%.2f", minAvailable, risk.getMinBalance()),
                    details);
        }
        if (minAvailable < risk.getMinBalance() * 2) {
            return check("minimum_balance", true, RiskLevel.MEDIUM,
                    String.format("Balance $%.2f is low but acceptable", minAvailable), details);
        }
        return check("minimum_balance", true, RiskLevel.LOW, "Balance check passed", details);
    }

    RiskCheckResult checkPositionLimits(SizingResult sizing) {
        Map<String, Object> details = Map.of(
                "position_value", sizing.getPositionValue(),
                "max_allowed", risk.getMaxPositionValue());

        if (sizing.getPositionValue() > risk.getMaxPositionValue()) {
            return check("position_limits", false, RiskLevel.HIGH,
                    String.format("Position value $%.2f exceeds max $%.2f",
                            sizing.getPositionValue(), risk.getMaxPositionValue()), details);
        }
        if (sizing.getPositionSize() <= 0) {
            return check("position_limits", false, RiskLevel.CRITICAL,
                    "Position size is zero or negative", Map.of("position_size", sizing.getPositionSize()));
        }
        return check("position_limits", true, RiskLevel.LOW, "Position limits check passed", details);
    }

    RiskCheckResult checkMarginSufficiency(SizingResult sizing, BalanceSnapshot first, BalanceSnapshot second) {
        double required = sizing.getMarginRequiredPerLeg() * (1 + risk.getMarginBufferRatio());
        boolean firstOk = first.getAvailable() >= required;
        boolean secondOk = second.getAvailable() >= required;

        if (!firstOk || !secondOk) {
            List<String> issues = new ArrayList<>();
            if (!firstOk) {
                issues.add(String.format("%s: $%.2f < $%.2f", name(first), first.getAvailable(), required));
            }
            if (!secondOk) {
                issues.add(String.format("%s: $%.2f < $%.2f", name(second), second.getAvailable(), required));
            }
            return check("margin_sufficiency", false, RiskLevel.HIGH,
                    "Insufficient margin with buffer: " + String.join("; ", issues),
                    Map.of("required_with_buffer", required, "buffer_ratio", risk.getMarginBufferRatio()));
        }

        double firstUtil = utilization(sizing.getMarginRequiredPerLeg(), first.getAvailable());
        double secondUtil = utilization(sizing.getMarginRequiredPerLeg(), second.getAvailable());
        double maxUtil = Math.max(firstUtil, secondUtil);

        return check("margin_sufficiency", true, maxUtil > HIGH_UTILIZATION ? RiskLevel.MEDIUM : RiskLevel.LOW,
                String.format("Margin check passed (max utilization: %.1f%%)", maxUtil * 100),
                Map.of("first_utilization", firstUtil, "second_utilization", secondUtil));
    }

    /**
     * Liquidation approximated at 1/leverage - maintenance margin away from the current price, for each leg.
     */
    RiskCheckResult checkLiquidationDistance(int leverage, double price, double mmFirst, double mmSecond) {
        if (leverage <= 0 || price <= 0) {
            return check("liquidation_risk", false, RiskLevel.CRITICAL,
                    "Invalid leverage or price for liquidation calculation",
                    Map.of("leverage", leverage, "price", price));
        }

        double firstDistance = Math.max(0.0, 1.0 / leverage - mmFirst);
        double secondDistance = Math.max(0.0, 1.0 / leverage - mmSecond);
        double closest = Math.min(firstDistance, secondDistance);
        Map<String, Object> details = Map.of(
                "first_distance_pct", firstDistance,
                "second_distance_pct", secondDistance);

        if (closest < MIN_LIQUIDATION_DISTANCE) {
            return check("liquidation_risk", false, RiskLevel.HIGH,
                    String.format("Liquidation too close: first %.1f%%, second %.1f%%",
                            firstDistance * 100, secondDistance * 100), details);
        }
        return check("liquidation_risk", true,
                closest < WARN_LIQUIDATION_DISTANCE ? RiskLevel.MEDIUM : RiskLevel.LOW,
                String.format("Liquidation distance OK (first: %.1f%%, second: %.1f%%)",
                        firstDistance * 100, secondDistance * 100), details);
    }

    RiskCheckResult checkLeverage(int leverage) {
        Map<String, Object> details = Map.of("leverage", leverage, "max_allowed", risk.getMaxLeverage());

        if (leverage > risk.getMaxLeverage()) {
            return check("leverage", false, RiskLevel.HIGH,
                    String.format("Leverage %dx exceeds maximum %dx", leverage, risk.getMaxLeverage()), details);
        }
        //Under-leveraged is safe, just off target
        if (leverage < risk.getMinLeverage()) {
            return check("leverage", true, RiskLevel.LOW,
                    String.format("Leverage %dx is below target range (%d-%dx)",
                            leverage, risk.getMinLeverage(), risk.getMaxLeverage()), details);
        }
        RiskLevel level = leverage <= risk.getSoftLeverageThreshold() ? RiskLevel.LOW : RiskLevel.MEDIUM;
        return check("leverage", true, level,
                String.format("Leverage %dx within acceptable range", leverage), details);
    }

    RiskAssessment aggregate(List<RiskCheckResult> checks) {
        List<String> blocking = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (RiskCheckResult check : checks) {
            if (!check.isPassed()) {
                blocking.add(check.getCheckName() + ": " + check.getMessage());
            } else if (check.getRiskLevel().isWarning()) {
                warnings.add(check.getCheckName() + ": " + check.getMessage());
            }
        }

        RiskLevel overall = checks.stream()
                .map(RiskCheckResult::getRiskLevel)
                .max(Comparator.naturalOrder())
                .orElse(RiskLevel.LOW);

        return RiskAssessment.builder()
                .checks(checks)
                .overallPassed(checks.stream().allMatch(RiskCheckResult::isPassed))
                .overallRisk(overall)
                .blockingIssues(List.copyOf(blocking))
                .warnings(List.copyOf(warnings))
                .build();
    }

    private static double utilization(double margin, double available) {
        return available > 0 ? margin / available : Double.POSITIVE_INFINITY;
    }

    private static String name(BalanceSnapshot balance) {
        return balance.getVenue() != null ? balance.getVenue().getDisplayName() : "venue";
    }

    private static RiskCheckResult check(String name, boolean passed, RiskLevel level, String message,
                                         Map<String, Object> details) {
        return RiskCheckResult.builder()
                .checkName(name)
                .passed(passed)
                .riskLevel(level)
                .message(message)
                .details(details)
                .build();
    }
}
