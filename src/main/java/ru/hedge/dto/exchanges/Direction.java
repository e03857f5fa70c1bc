package ru.hedge.dto.exchanges;

public enum Direction {
    LONG,
    SHORT;

    public Direction opposite() {
        return this == LONG ? SHORT : LONG;
    }
}
