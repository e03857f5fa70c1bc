package ru.hedge.utils;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket shared by every call to one venue. Callers wait in arrival order (fair lock),
 * requests are delayed but never dropped.
 */
@Slf4j
public class TokenBucketRateLimiter implements RequestRateLimiter {

    private final double tokensPerMilli;
    private final double capacity;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ReentrantLock lock = new ReentrantLock(true);

    private double tokens;
    private long lastRefillMillis;

    public TokenBucketRateLimiter(int requestsPerMinute, int burst, Clock clock, Sleeper sleeper) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive: " + requestsPerMinute);
        }
        this.tokensPerMilli = requestsPerMinute / 60_000.0;
        this.capacity = burst > 0 ? burst : Math.max(1, requestsPerMinute / 60);
        this.clock = clock;
        this.sleeper = sleeper;
        this.tokens = capacity;
        this.lastRefillMillis = clock.millis();
    }

    @Override
    public void acquire() {
        lock.lock();
        try {
            while (true) {
                refill();
                if (tokens >= 1.0) {
                    tokens -= 1.0;
                    return;
                }
                long waitMillis = (long) Math.ceil((1.0 - tokens) / tokensPerMilli);
                log.debug("[RateLimiter] Bucket empty, waiting {} ms", waitMillis);
                try {
                    sleeper.sleep(Duration.ofMillis(Math.max(1, waitMillis)));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[RateLimiter] Interrupted while waiting for a token");
                    throw new IllegalStateException("Interrupted while waiting for rate limit", e);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    private void refill() {
        long now = clock.millis();
        long elapsed = now - lastRefillMillis;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * tokensPerMilli);
            lastRefillMillis = now;
        }
    }
}
