package ru.hedge.dto.safety;

public enum EmergencyReason {
    USER_INTERRUPT,
    CONSECUTIVE_FAILURES,
    UNHEDGED_EXPOSURE,
    MARGIN_CALL,
    CONNECTION_LOST,
    SYSTEM_ERROR,
    MANUAL_TRIGGER
}
