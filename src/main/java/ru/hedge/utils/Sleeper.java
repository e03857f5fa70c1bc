package ru.hedge.utils;

import java.time.Duration;

/**
 * Blocking pause used by the hold and cooldown loops and the rate limiter. Tests substitute a recording one.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
