package ru.hedge.dto.cycle;

public enum CycleState {
    IDLE,
    OPENING,
    HOLDING,
    CLOSING,
    COOLDOWN,
    ERROR,
    EMERGENCY
}
