package ru.hedge.dto.cycle;

import lombok.Builder;
import lombok.Value;

/**
 * Randomized parameters of one trading cycle. Drawn once at cycle start and kept for the whole cycle.
 */
@Value
@Builder
public class CycleParameters {
    String token;
    double equityUsage;
    int leverage;
    int holdDurationSeconds;
    int cooldownSeconds;
}
