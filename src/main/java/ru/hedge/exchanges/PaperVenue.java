package ru.hedge.exchanges;

import lombok.extern.slf4j.Slf4j;
import ru.hedge.config.HedgeConfig;
import ru.hedge.dto.exchanges.*;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * In-memory venue for simulation mode. Market orders fill at the mark price,
 * limit orders rest until cancelled. Margin is isolated per position.
 */
@Slf4j
public class PaperVenue implements Venue {

    private static final long FUNDING_INTERVAL_MS = 8 * 60 * 60 * 1000L;

    private final VenueType type;
    private final Clock clock;
    private final double minOrderSize;
    private final int maxLeverage;
    private final double maintenanceMarginRate;

    private final Map<String, Double> prices = new HashMap<>();
    private double fundingRate;
    private double cash;
    private boolean connected;

    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final Map<String, Integer> leverage = new HashMap<>();
    private final Map<String, OrderRequest> restingOrders = new LinkedHashMap<>();
    private final Map<String, OrderResult> byExternalId = new HashMap<>();

    public PaperVenue(VenueType type, HedgeConfig config, Clock clock) {
        HedgeConfig.PaperConfig paper = config.getPaper();
        this.type = type;
        this.clock = clock;
        this.cash = paper.getBalance();
        this.prices.putAll(paper.getPrices());
        this.fundingRate = paper.getFundingRates().getOrDefault(type, 0.0);
        this.minOrderSize = paper.getMinOrderSize();
        this.maxLeverage = paper.getMaxLeverage();
        this.maintenanceMarginRate = config.getRisk().getDefaultMaintenanceMargin();
    }

    @Override
    public VenueType getType() {
        return type;
    }

    @Override
    public String getName() {
        return type.getDisplayName();
    }

    @Override
    public synchronized boolean connect() {
        connected = true;
        log.info("[{}] Paper venue connected, balance ${}", getName(), String.format("%.2f", cash));
        return true;
    }

    @Override
    public synchronized void disconnect() {
        connected = false;
        log.info("[{}] Paper venue disconnected", getName());
    }

    @Override
    public synchronized boolean isConnected() {
        return connected;
    }

    @Override
    public String formatSymbol(String token) {
        return type == VenueType.EXTENDED ? token + "-USD" : token;
    }

    @Override
    public synchronized MarketInfo getMarketInfo(String token) {
        double price = priceOf(token);
        long now = clock.millis();
        return MarketInfo.builder()
                .venue(type)
                .token(token)
                .symbol(formatSymbol(token))
                .markPrice(price)
                .indexPrice(price)
                .lastPrice(price)
                .bidPrice(price)
                .askPrice(price)
                .fundingRate(fundingRate)
                .nextFundingTime(now - now % FUNDING_INTERVAL_MS + FUNDING_INTERVAL_MS)
                .minOrderSize(minOrderSize)
                .minOrderSizeChange(minOrderSize)
                .maxLeverage(maxLeverage)
                .maintenanceMarginRate(maintenanceMarginRate)
                .build();
    }

    @Override
    public synchronized Balance getBalance() {
        double margin = 0;
        double unrealized = 0;
        for (Position position : positions.values()) {
            margin += position.getSize() * position.getEntryPrice() / Math.max(1, position.getLeverage());
            unrealized += unrealizedPnl(position, priceOf(position.getToken()));
        }
        return Balance.builder()
                .venue(type)
                .balance(cash)
                .equity(cash + unrealized)
                .availableForTrade(Math.max(0, cash + unrealized - margin))
                .marginUsed(margin)
                .unrealizedPnl(unrealized)
                .build();
    }

    @Override
    public synchronized List<Position> getPositions(String token) {
        List<Position> result = new ArrayList<>();
        for (Position position : positions.values()) {
            if (token == null || token.equalsIgnoreCase(position.getToken())) {
                double price = priceOf(position.getToken());
                position.setMarkPrice(price);
                position.setUnrealizedPnl(unrealizedPnl(position, price));
                result.add(copy(position));
            }
        }
        return result;
    }

    @Override
    public synchronized OrderResult placeOrder(OrderRequest request) {
        String symbol = formatSymbol(request.getToken());
        if (request.getExternalId() != null && byExternalId.containsKey(request.getExternalId())) {
            log.info("[{}] Duplicate external id {}, returning original result", getName(), request.getExternalId());
            return byExternalId.get(request.getExternalId());
        }
        OrderResult result = execute(request, symbol);
        if (request.getExternalId() != null) {
            byExternalId.put(request.getExternalId(), result);
        }
        return result;
    }

    private OrderResult execute(OrderRequest request, String symbol) {
        if (!connected) {
            return OrderResult.rejected(type, symbol, "NOT_CONNECTED", "Venue not connected");
        }
        if (request.getQuantity() < minOrderSize) {
            return OrderResult.rejected(type, symbol, "MIN_SIZE",
                    "Quantity " + request.getQuantity() + " below minimum " + minOrderSize);
        }
        if (request.getType() == OrderType.LIMIT) {
            String orderId = UUID.randomUUID().toString();
            restingOrders.put(orderId, request);
            return OrderResult.builder()
                    .venue(type)
                    .symbol(symbol)
                    .success(true)
                    .orderId(orderId)
                    .externalId(request.getExternalId())
                    .message("Resting")
                    .timestamp(clock.millis())
                    .build();
        }

        String token = request.getToken();
        double price = priceOf(token);
        if (request.getPrice() != null && !request.isReduceOnly()
                && beyondLimit(request.getSide(), price, request.getPrice())) {
            return OrderResult.rejected(type, symbol, "SLIPPAGE",
                    "Mark " + price + " beyond limit " + request.getPrice());
        }
        Position existing = positions.get(token);

        if (request.isReduceOnly()) {
            if (existing == null || existing.getSide() == request.getSide()) {
                return OrderResult.rejected(type, symbol, "REDUCE_ONLY", "Nothing to reduce");
            }
            return reduce(existing, Math.min(request.getQuantity(), existing.getSize()), price, request.getExternalId());
        }

        if (existing != null && existing.getSide() != request.getSide()) {
            double reduceBy = Math.min(request.getQuantity(), existing.getSize());
            OrderResult reduced = reduce(existing, reduceBy, price, request.getExternalId());
            double remainder = request.getQuantity() - reduceBy;
            if (remainder <= 0) {
                return reduced;
            }
            return open(token, request.getSide(), remainder, price, request.getExternalId());
        }
        return open(token, request.getSide(), request.getQuantity(), price, request.getExternalId());
    }

    @Override
    public synchronized boolean cancelOrder(String token, String orderId) {
        return restingOrders.remove(orderId) != null;
    }

    @Override
    public synchronized int cancelAllOrders(String token) {
        int before = restingOrders.size();
        restingOrders.values().removeIf(o -> token == null || token.equalsIgnoreCase(o.getToken()));
        return before - restingOrders.size();
    }

    @Override
    public synchronized OrderResult closePosition(String token, Double quantity) {
        Position existing = positions.get(token);
        if (existing == null) {
            return OrderResult.builder()
                    .venue(type)
                    .symbol(formatSymbol(token))
                    .success(true)
                    .message("No open position")
                    .timestamp(clock.millis())
                    .build();
        }
        double size = quantity == null ? existing.getSize() : Math.min(quantity, existing.getSize());
        return reduce(existing, size, priceOf(token), null);
    }

    @Override
    public synchronized boolean setLeverage(String token, int value) {
        if (value <= 0 || value > maxLeverage) {
            return false;
        }
        leverage.put(token, value);
        return true;
    }

    @Override
    public synchronized int getLeverage(String token) {
        return leverage.getOrDefault(token, 1);
    }

    public synchronized void setMarkPrice(String token, double price) {
        prices.put(token, price);
    }

    public synchronized void setFundingRate(double fundingRate) {
        this.fundingRate = fundingRate;
    }

    private OrderResult open(String token, Direction side, double quantity, double price, String externalId) {
        int lev = getLeverage(token);
        double required = quantity * price / lev;
        double available = getBalance().getAvailableForTrade();
        if (required > available) {
            return OrderResult.rejected(type, formatSymbol(token), "INSUFFICIENT_MARGIN",
                    String.format("Need $%.2f margin, have $%.2f", required, available));
        }

        Position existing = positions.get(token);
        if (existing == null) {
            positions.put(token, Position.builder()
                    .venue(type)
                    .token(token)
                    .symbol(formatSymbol(token))
                    .side(side)
                    .size(quantity)
                    .entryPrice(price)
                    .markPrice(price)
                    .leverage(lev)
                    .build());
        } else {
            double size = existing.getSize() + quantity;
            existing.setEntryPrice((existing.getEntryPrice() * existing.getSize() + price * quantity) / size);
            existing.setSize(size);
        }
        log.info("[{}] Paper fill {} {} {} @ {}", getName(), side, quantity, token, price);
        return filled(token, quantity, price, externalId);
    }

    private OrderResult reduce(Position position, double quantity, double price, String externalId) {
        double sign = position.getSide() == Direction.LONG ? 1 : -1;
        double realized = sign * (price - position.getEntryPrice()) * quantity;
        cash += realized;
        position.setRealizedPnl(position.getRealizedPnl() + realized);
        position.setSize(position.getSize() - quantity);
        if (position.getSize() <= minOrderSize / 2) {
            positions.remove(position.getToken());
        }
        log.info("[{}] Paper close {} {} @ {}, realized {}", getName(), quantity, position.getToken(), price,
                String.format("%.4f", realized));
        return filled(position.getToken(), quantity, price, externalId);
    }

    private OrderResult filled(String token, double quantity, double price, String externalId) {
        return OrderResult.builder()
                .venue(type)
                .symbol(formatSymbol(token))
                .success(true)
                .orderId(UUID.randomUUID().toString())
                .externalId(externalId)
                .filledQuantity(quantity)
                .averagePrice(price)
                .timestamp(clock.millis())
                .build();
    }

    private double priceOf(String token) {
        Double price = prices.get(token);
        if (price == null) {
            throw new IllegalArgumentException("No paper price for " + token);
        }
        return price;
    }

    //Market orders carry a worst acceptable price
    private static boolean beyondLimit(Direction side, double mark, double limit) {
        return side == Direction.LONG ? mark > limit : mark < limit;
    }

    private static double unrealizedPnl(Position position, double price) {
        double sign = position.getSide() == Direction.LONG ? 1 : -1;
        return sign * (price - position.getEntryPrice()) * position.getSize();
    }

    private static Position copy(Position p) {
        return Position.builder()
                .venue(p.getVenue())
                .token(p.getToken())
                .symbol(p.getSymbol())
                .side(p.getSide())
                .size(p.getSize())
                .entryPrice(p.getEntryPrice())
                .markPrice(p.getMarkPrice())
                .unrealizedPnl(p.getUnrealizedPnl())
                .realizedPnl(p.getRealizedPnl())
                .fundingAccumulated(p.getFundingAccumulated())
                .leverage(p.getLeverage())
                .build();
    }
}
