package ru.hedge.dto.sizing;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Matched size for both legs.
 * fitsConstraints is true only when size and per-leg margin are positive and both venues can cover the margin.
 */
@Value
@Builder
public class SizingResult {
    String token;
    double positionSize;
    double positionValue;

    double marginRequiredPerLeg;
    double totalMarginRequired;

    double equityUsage;
    int leverage;
    double effectiveLeverage;
    double availableBalanceUsed;

    boolean fitsConstraints;
    @Builder.Default
    List<String> constraintNotes = List.of();

    public static SizingResult rejected(String token, double equityUsage, int leverage, List<String> notes) {
        return SizingResult.builder()
                .token(token)
                .equityUsage(equityUsage)
                .leverage(leverage)
                .fitsConstraints(false)
                .constraintNotes(List.copyOf(notes))
                .build();
    }
}
