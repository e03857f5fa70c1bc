package ru.hedge.dto.risk;

/**
 * Ordered by severity, the declaration order is relied upon when aggregating.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isWarning() {
        return this == MEDIUM || this == HIGH;
    }
}
