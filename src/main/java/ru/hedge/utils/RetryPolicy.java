package ru.hedge.utils;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import ru.hedge.exceptions.TransientVenueException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff for idempotent reads. Only {@link TransientVenueException} is retried.
 */
@Slf4j
@Getter
public class RetryPolicy {

    private final boolean enabled;
    private final int maxAttempts;
    private final long initialBackoffMillis;
    private final long maxBackoffMillis;
    private final Sleeper sleeper;

    public RetryPolicy(boolean enabled, int maxAttempts, long initialBackoffMillis, long maxBackoffMillis, Sleeper sleeper) {
        this.enabled = enabled;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMillis = Math.max(0, initialBackoffMillis);
        this.maxBackoffMillis = Math.max(this.initialBackoffMillis, maxBackoffMillis);
        this.sleeper = sleeper;
    }

    public static RetryPolicy disabled() {
        return new RetryPolicy(false, 1, 0, 0, Sleeper.system());
    }

    public <T> T execute(String operation, Supplier<T> call) {
        int attempts = enabled ? maxAttempts : 1;
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (TransientVenueException e) {
                if (attempt >= attempts) {
                    log.warn("[Retry] {} failed after {} attempts: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                long backoff = backoffMillis(attempt);
                log.info("[Retry] {} attempt {}/{} failed ({}), retrying in {} ms",
                        operation, attempt, attempts, e.getMessage(), backoff);
                try {
                    sleeper.sleep(Duration.ofMillis(backoff));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("[Retry] Interrupted during backoff of {}", operation);
                    throw e;
                }
            }
        }
    }

    long backoffMillis(int attempt) {
        long backoff = initialBackoffMillis << Math.min(attempt - 1, 20);
        return Math.min(backoff, maxBackoffMillis);
    }
}
