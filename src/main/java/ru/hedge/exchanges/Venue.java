package ru.hedge.exchanges;

import ru.hedge.dto.exchanges.*;

import java.util.List;

/**
 * Capability set of one perpetual futures venue. Any call may fail with
 * {@link ru.hedge.exceptions.TransientVenueException} (retryable) or
 * {@link ru.hedge.exceptions.VenueRejectedException} (not retried).
 */
public interface Venue {

    VenueType getType();

    String getName();

    boolean connect();

    void disconnect();

    boolean isConnected();

    /**
     * Translate a token (BTC) into the venue's market symbol
     */
    String formatSymbol(String token);

    MarketInfo getMarketInfo(String token);

    Balance getBalance();

    /**
     * @param token market to filter by, or null for every open position
     */
    List<Position> getPositions(String token);

    OrderResult placeOrder(OrderRequest request);

    boolean cancelOrder(String token, String orderId);

    /**
     * @param token market to filter by, or null for all markets
     * @return number of cancelled orders
     */
    int cancelAllOrders(String token);

    /**
     * Reduce-only market close. Quantity null closes the whole position.
     * Closing when nothing is open counts as success.
     */
    OrderResult closePosition(String token, Double quantity);

    boolean setLeverage(String token, int leverage);

    int getLeverage(String token);
}
