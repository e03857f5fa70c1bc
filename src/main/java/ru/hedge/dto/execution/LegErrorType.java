package ru.hedge.dto.execution;

public enum LegErrorType {
    EXCHANGE_REJECTED,
    TIMEOUT,
    UNEXPECTED_EXCEPTION,
    NOT_ATTEMPTED //sequential mode, first leg already failed
}
