package ru.hedge.utils;

public interface RequestRateLimiter {

    void acquire();

    static RequestRateLimiter noop() {
        return () -> {
        };
    }
}
