package ru.hedge.dto.exchanges;

public enum OrderType {
    MARKET,
    LIMIT,
    CONDITIONAL
}
