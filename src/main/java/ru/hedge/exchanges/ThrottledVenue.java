package ru.hedge.exchanges;

import lombok.extern.slf4j.Slf4j;
import ru.hedge.dto.exchanges.*;
import ru.hedge.service.SecureRandomSource;
import ru.hedge.utils.RequestRateLimiter;
import ru.hedge.utils.RetryPolicy;

import java.util.List;
import java.util.function.Supplier;

/**
 * Puts every call to a venue through its token bucket and retries idempotent calls on transient errors.
 * Orders are never retried here: a second attempt needs a new external id and a fresh decision.
 */
@Slf4j
public class ThrottledVenue implements Venue {

    private final Venue delegate;
    private final RequestRateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final SecureRandomSource randomSource;

    public ThrottledVenue(Venue delegate, RequestRateLimiter rateLimiter, RetryPolicy retryPolicy,
                          SecureRandomSource randomSource) {
        this.delegate = delegate;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.randomSource = randomSource;
    }

    public Venue getDelegate() {
        return delegate;
    }

    @Override
    public VenueType getType() {
        return delegate.getType();
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public boolean connect() {
        return retried("connect", delegate::connect);
    }

    @Override
    public void disconnect() {
        rateLimiter.acquire();
        delegate.disconnect();
    }

    @Override
    public boolean isConnected() {
        //Local state, not a venue request
        return delegate.isConnected();
    }

    @Override
    public String formatSymbol(String token) {
        return delegate.formatSymbol(token);
    }

    @Override
    public MarketInfo getMarketInfo(String token) {
        return retried("getMarketInfo " + token, () -> delegate.getMarketInfo(token));
    }

    @Override
    public Balance getBalance() {
        return retried("getBalance", delegate::getBalance);
    }

    @Override
    public List<Position> getPositions(String token) {
        return retried("getPositions", () -> delegate.getPositions(token));
    }

    @Override
    public OrderResult placeOrder(OrderRequest request) {
        OrderRequest tagged = request.getExternalId() != null
                ? request
                : request.toBuilder().externalId(randomSource.generateExternalId()).build();
        rateLimiter.acquire();
        return delegate.placeOrder(tagged);
    }

    @Override
    public boolean cancelOrder(String token, String orderId) {
        return retried("cancelOrder " + orderId, () -> delegate.cancelOrder(token, orderId));
    }

    @Override
    public int cancelAllOrders(String token) {
        return retried("cancelAllOrders", () -> delegate.cancelAllOrders(token));
    }

    @Override
    public OrderResult closePosition(String token, Double quantity) {
        rateLimiter.acquire();
        return delegate.closePosition(token, quantity);
    }

    @Override
    public boolean setLeverage(String token, int leverage) {
        return retried("setLeverage " + token, () -> delegate.setLeverage(token, leverage));
    }

    @Override
    public int getLeverage(String token) {
        return retried("getLeverage " + token, () -> delegate.getLeverage(token));
    }

    private <T> T retried(String operation, Supplier<T> call) {
        return retryPolicy.execute(getName() + " " + operation, () -> {
            rateLimiter.acquire();
            return call.get();
        });
    }
}
