package ru.hedge.utils;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TokenBucketRateLimiterTest {

    private MutableClock clock;
    private RecordingSleeper sleeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        sleeper = new RecordingSleeper();
        //Sleeping moves time forward, as it would for real
        sleeper.onSleep(n -> clock.advance(sleeper.getSleeps().get(n - 1)));
    }

    @Test
    void burstIsServedWithoutWaiting() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(60, 5, clock, sleeper);

        for (int i = 0; i < 5; i++) {
            limiter.acquire();
        }

        assertThat(sleeper.getSleeps()).isEmpty();
        assertThat(limiter.availableTokens()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void requestBeyondBurstWaitsForRefill() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(60, 2, clock, sleeper);

        limiter.acquire();
        limiter.acquire();
        limiter.acquire();

        assertThat(sleeper.totalMillis()).isBetween(1_000L, 1_001L);
    }

    @Test
    void refillIsCappedAtCapacity() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(60, 3, clock, sleeper);
        limiter.acquire();

        clock.advance(Duration.ofMinutes(10));

        assertThat(limiter.availableTokens()).isEqualTo(3.0);
    }

    @Test
    void unsetBurstDefaultsToOneSecondOfRequests() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(120, 0, clock, sleeper);

        assertThat(limiter.availableTokens()).isEqualTo(2.0);
    }

    @Test
    void rejectsNonPositiveRate() {
        assertThatThrownBy(() -> new TokenBucketRateLimiter(0, 5, clock, sleeper))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void interruptedWaitFailsTheCall() {
        Sleeper interrupted = duration -> {
            throw new InterruptedException();
        };
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter(60, 1, clock, interrupted);
        limiter.acquire();

        assertThatThrownBy(limiter::acquire).isInstanceOf(IllegalStateException.class);
        assertThat(Thread.interrupted()).isTrue();
    }
}
