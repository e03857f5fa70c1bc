package ru.hedge.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.hedge.config.HedgeConfig;
import ru.hedge.dto.sizing.BalanceSnapshot;
import ru.hedge.dto.sizing.SizingResult;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Matched size for both legs, driven by the smaller of the two available balances.
 * A result with fitsConstraints=true always has positive size and margin that both venues can cover.
 */
@Slf4j
@Service
public class PositionSizer {

    private final double safetyBuffer;
    private final double minPositionValue;
    private final double maxPositionValue;
    private final double maxEquityUsage;

    public PositionSizer(HedgeConfig config) {
        HedgeConfig.RiskConfig risk = config.getRisk();
        this.safetyBuffer = risk.getSafetyBuffer();
        this.minPositionValue = risk.getMinPositionValue();
        this.maxPositionValue = risk.getMaxPositionValue();
        this.maxEquityUsage = risk.getMaxEquityUsage();
    }

    public SizingResult calculateSize(String token, double price,
                                      BalanceSnapshot first, BalanceSnapshot second,
                                      double equityUsage, int leverage,
                                      double minOrderSize, int precision) {
        List<String> notes = new ArrayList<>();

        double minAvailable = Math.min(first.getAvailable(), second.getAvailable());
        if (minAvailable <= 0) {
            notes.add("Insufficient available balance on one or both venues");
            return reject(token, equityUsage, leverage, notes);
        }

        double capitalPerLeg = minAvailable * equityUsage;
        double notional = capitalPerLeg * leverage;

        //Skip the cycle instead of forcing it up to the minimum
        if (notional < minPositionValue) {
            notes.add(String.format("Position value $%.2f below minimum $%.2f", notional, minPositionValue));
            notional = 0;
        }
        if (notional > maxPositionValue) {
            notes.add(String.format("Position value capped from $%.2f to $%.2f", notional, maxPositionValue));
            notional = maxPositionValue;
        }

        if (price <= 0 || Double.isNaN(price) || Double.isInfinite(price)) {
            notes.add("Invalid token price");
            return reject(token, equityUsage, leverage, notes);
        }

        double buffered = notional / price * safetyBuffer;
        double size = roundDown(buffered, precision);

        if (size < minOrderSize) {
            notes.add(String.format("Position size %s below minimum %s", size, minOrderSize));
            return reject(token, equityUsage, leverage, notes);
        }
        if (size <= 0 || leverage <= 0) {
            notes.add("Invalid position size or leverage");
            return reject(token, equityUsage, leverage, notes);
        }

        //Recompute from the rounded size, that is what will actually be ordered
        double actualValue = size * price;
        double marginPerLeg = actualValue / leverage;

        boolean fits = true;
        if (marginPerLeg > first.getAvailable()) {
            fits = false;
            notes.add("Insufficient margin on " + venueName(first) + " after sizing");
        }
        if (marginPerLeg > second.getAvailable()) {
            fits = false;
            notes.add("Insufficient margin on " + venueName(second) + " after sizing");
        }
        //A rejected sizing never carries a size
        if (!fits || marginPerLeg <= 0) {
            return reject(token, equityUsage, leverage, notes);
        }

        SizingResult result = SizingResult.builder()
                .token(token)
                .positionSize(size)
                .positionValue(actualValue)
                .marginRequiredPerLeg(marginPerLeg)
                .totalMarginRequired(marginPerLeg * 2)
                .equityUsage(equityUsage)
                .leverage(leverage)
                .effectiveLeverage(leverage)
                .availableBalanceUsed(marginPerLeg)
                .fitsConstraints(true)
                .constraintNotes(List.copyOf(notes))
                .build();

        log.info("[Sizer] {} size={} value=${} margin/leg=${} fits={}",
                token, size, String.format("%.2f", actualValue),
                String.format("%.2f", marginPerLeg), result.isFitsConstraints());
        return result;
    }

    /**
     * Smallest leverage that reaches the target size, capped at maxLeverage.
     * Above the cap the best achievable size at maxLeverage is returned instead.
     */
    public SizingResult calculateWithMaxLeverageForSize(String token, double price, double targetSize,
                                                        BalanceSnapshot first, BalanceSnapshot second,
                                                        int maxLeverage, double minOrderSize, int precision) {
        double targetValue = targetSize * price;
        double minAvailable = Math.min(first.getAvailable(), second.getAvailable());
        if (minAvailable <= 0 || targetValue <= 0) {
            return reject(token, 0, maxLeverage,
                    List.of("Cannot size for target " + targetSize + " with available $" + minAvailable));
        }

        int requiredLeverage = (int) (targetValue / minAvailable) + 1;
        if (requiredLeverage > maxLeverage) {
            double equity = Math.min(maxEquityUsage, minAvailable / targetValue);
            return calculateSize(token, price, first, second, equity, maxLeverage, minOrderSize, precision);
        }

        double equity = targetValue / (minAvailable * requiredLeverage);
        return calculateSize(token, price, first, second, equity, requiredLeverage, minOrderSize, precision);
    }

    /**
     * Re-checks a sizing against fresher balances.
     *
     * @return issues, empty when the sizing is still valid
     */
    public List<String> validateSizing(SizingResult sizing, BalanceSnapshot first, BalanceSnapshot second) {
        List<String> issues = new ArrayList<>();
        if (sizing.getPositionSize() <= 0) {
            issues.add("Position size must be positive");
        }

        double margin = sizing.getMarginRequiredPerLeg();
        for (BalanceSnapshot balance : List.of(first, second)) {
            if (margin > balance.getAvailable()) {
                issues.add(String.format("%s: need $%.2f, have $%.2f (deficit: $%.2f)",
                        venueName(balance), margin, balance.getAvailable(), margin - balance.getAvailable()));
            }
        }

        double totalAvailable = first.getAvailable() + second.getAvailable();
        if (sizing.getTotalMarginRequired() > totalAvailable) {
            issues.add(String.format("Total margin $%.2f exceeds combined available $%.2f",
                    sizing.getTotalMarginRequired(), totalAvailable));
        }
        if (sizing.getPositionValue() < minPositionValue) {
            issues.add(String.format("Position value $%.2f below minimum $%.2f",
                    sizing.getPositionValue(), minPositionValue));
        }
        if (sizing.getPositionValue() > maxPositionValue) {
            issues.add(String.format("Position value $%.2f exceeds maximum $%.2f",
                    sizing.getPositionValue(), maxPositionValue));
        }
        return issues;
    }

    static double roundDown(double value, int precision) {
        if (value <= 0 || Double.isNaN(value)) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(precision, RoundingMode.DOWN).doubleValue();
    }

    private SizingResult reject(String token, double equityUsage, int leverage, List<String> notes) {
        log.warn("[Sizer] {} rejected: {}", token, notes);
        return SizingResult.rejected(token, equityUsage, leverage, notes);
    }

    private static String venueName(BalanceSnapshot balance) {
        return balance.getVenue() != null ? balance.getVenue().getDisplayName() : "venue";
    }
}
