package ru.hedge.dto.execution;

public enum ExecutionState {
    PENDING,
    OPENING_FIRST,
    OPENING_SECOND,
    COMPLETE,
    ROLLING_BACK,
    ROLLED_BACK,
    FAILED
}
