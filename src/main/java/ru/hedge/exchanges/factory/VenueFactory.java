package ru.hedge.exchanges.factory;

import lombok.extern.slf4j.Slf4j;
import ru.hedge.config.HedgeConfig;
import ru.hedge.dto.exchanges.VenueType;
import ru.hedge.exchanges.ThrottledVenue;
import ru.hedge.exchanges.Venue;
import ru.hedge.service.SecureRandomSource;
import ru.hedge.utils.RequestRateLimiter;
import ru.hedge.utils.RetryPolicy;
import ru.hedge.utils.Sleeper;
import ru.hedge.utils.TokenBucketRateLimiter;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves registered venues by type. Each venue comes back wrapped in its own rate limiter.
 */
@Slf4j
public class VenueFactory {

    private final Map<VenueType, Venue> venues = new EnumMap<>(VenueType.class);
    private final HedgeConfig config;

    public VenueFactory(List<Venue> venueList, HedgeConfig config, Clock clock, Sleeper sleeper,
                        SecureRandomSource randomSource) {
        this.config = config;
        RetryPolicy retry = buildRetryPolicy(config.getRetry(), sleeper);

        for (Venue venue : venueList) {
            if (venues.containsKey(venue.getType())) {
                throw new IllegalStateException("Duplicate venue registered: " + venue.getType());
            }
            RequestRateLimiter limiter = buildRateLimiter(config.getRateLimit(), clock, sleeper);
            venues.put(venue.getType(), new ThrottledVenue(venue, limiter, retry, randomSource));
        }

        log.info("[VenueFactory] Initialized with {} venues: {}", venues.size(), venues.keySet());
    }

    public Venue getVenue(VenueType type) {
        Venue venue = venues.get(type);
        if (venue == null) {
            throw new IllegalArgumentException("Venue not found: " + type);
        }
        return venue;
    }

    public Venue getVenue(String name) {
        VenueType type;
        try {
            type = VenueType.valueOf(name.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown venue: " + name, e);
        }
        return getVenue(type);
    }

    public Venue getFirst() {
        return getVenue(config.getVenues().getFirst());
    }

    public Venue getSecond() {
        return getVenue(config.getVenues().getSecond());
    }

    public List<Venue> getAllVenues() {
        return List.copyOf(venues.values());
    }

    static RequestRateLimiter buildRateLimiter(HedgeConfig.RateLimitConfig cfg, Clock clock, Sleeper sleeper) {
        if (cfg == null || !cfg.isEnabled() || cfg.getRequestsPerMinute() <= 0) {
            return RequestRateLimiter.noop();
        }
        return new TokenBucketRateLimiter(cfg.getRequestsPerMinute(), cfg.getBurst(), clock, sleeper);
    }

    static RetryPolicy buildRetryPolicy(HedgeConfig.RetryConfig cfg, Sleeper sleeper) {
        if (cfg == null) {
            return RetryPolicy.disabled();
        }
        return new RetryPolicy(cfg.isEnabled(), cfg.getMaxAttempts(),
                cfg.getInitialBackoffMs(), cfg.getMaxBackoffMs(), sleeper);
    }
}
