package ru.hedge.exchanges;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.hedge.config.HedgeConfig;
import ru.hedge.dto.exchanges.Balance;
import ru.hedge.dto.exchanges.Direction;
import ru.hedge.dto.exchanges.MarketInfo;
import ru.hedge.dto.exchanges.OrderRequest;
import ru.hedge.dto.exchanges.OrderResult;
import ru.hedge.dto.exchanges.OrderType;
import ru.hedge.dto.exchanges.Position;
import ru.hedge.dto.exchanges.VenueType;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PaperVenueTest {

    private PaperVenue venue;

    @BeforeEach
    void setUp() {
        venue = new PaperVenue(VenueType.EXTENDED, new HedgeConfig(),
                Clock.fixed(Instant.parse("2026-01-01T03:00:00Z"), ZoneOffset.UTC));
        venue.connect();
    }

    @Test
    void marketOrderFillsAtMarkPrice() {
        venue.setLeverage("BTC", 10);

        OrderResult result = venue.placeOrder(order(Direction.LONG, 0.5, "id-1"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAveragePrice()).isEqualTo(50_000);
        assertThat(result.getSymbol()).isEqualTo("BTC-USD");
        Position position = venue.getPositions("BTC").get(0);
        assertThat(position.getSide()).isEqualTo(Direction.LONG);
        assertThat(position.getSize()).isEqualTo(0.5);

        Balance balance = venue.getBalance();
        assertThat(balance.getMarginUsed()).isCloseTo(2_500, within(1e-9));
        assertThat(balance.getAvailableForTrade()).isCloseTo(7_500, within(1e-9));
    }

    @Test
    void repeatedExternalIdDoesNotFillTwice() {
        venue.setLeverage("BTC", 10);

        OrderResult firstAttempt = venue.placeOrder(order(Direction.SHORT, 0.1, "same"));
        OrderResult secondAttempt = venue.placeOrder(order(Direction.SHORT, 0.1, "same"));

        assertThat(secondAttempt).isSameAs(firstAttempt);
        assertThat(venue.getPositions("BTC").get(0).getSize()).isEqualTo(0.1);
    }

    @Test
    void insufficientMarginIsRejected() {
        OrderResult result = venue.placeOrder(order(Direction.LONG, 1, "big"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo("INSUFFICIENT_MARGIN");
        assertThat(venue.getPositions(null)).isEmpty();
    }

    @Test
    void marketOrderBeyondWorstPriceIsRejected() {
        venue.setLeverage("BTC", 10);
        venue.setMarkPrice("BTC", 50_500);

        OrderResult longFill = venue.placeOrder(order(Direction.LONG, 0.1, "a").toBuilder().price(50_250.0).build());
        OrderResult shortFill = venue.placeOrder(order(Direction.SHORT, 0.1, "b").toBuilder().price(50_250.0).build());

        assertThat(longFill.isSuccess()).isFalse();
        assertThat(longFill.getErrorCode()).isEqualTo("SLIPPAGE");
        assertThat(shortFill.isSuccess()).isTrue();
        assertThat(shortFill.getAveragePrice()).isEqualTo(50_500);
    }

    @Test
    void disconnectedVenueRejectsOrders() {
        venue.disconnect();

        assertThat(venue.placeOrder(order(Direction.LONG, 0.01, null)).getErrorCode()).isEqualTo("NOT_CONNECTED");
    }

    @Test
    void closeRealizesPnl() {
        venue.setLeverage("ETH", 10);
        venue.placeOrder(OrderRequest.builder().token("ETH").side(Direction.SHORT).quantity(2).build());
        venue.setMarkPrice("ETH", 2_900);

        assertThat(venue.getPositions("ETH").get(0).getUnrealizedPnl()).isCloseTo(200, within(1e-9));
        OrderResult close = venue.closePosition("ETH", null);

        assertThat(close.getFilledQuantity()).isEqualTo(2);
        assertThat(venue.getPositions("ETH")).isEmpty();
        assertThat(venue.getBalance().getBalance()).isCloseTo(10_200, within(1e-9));
    }

    @Test
    void closingNothingSucceeds() {
        OrderResult result = venue.closePosition("SOL", null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMessage()).isEqualTo("No open position");
    }

    @Test
    void limitOrdersRestUntilCancelled() {
        venue.placeOrder(OrderRequest.builder().token("BTC").side(Direction.LONG).quantity(0.01)
                .type(OrderType.LIMIT).price(40_000.0).build());
        venue.placeOrder(OrderRequest.builder().token("ETH").side(Direction.LONG).quantity(0.1)
                .type(OrderType.LIMIT).price(2_000.0).build());

        assertThat(venue.getPositions(null)).isEmpty();
        assertThat(venue.cancelAllOrders("BTC")).isEqualTo(1);
        assertThat(venue.cancelAllOrders(null)).isEqualTo(1);
    }

    @Test
    void reduceOnlyNeedsOppositePosition() {
        OrderResult result = venue.placeOrder(OrderRequest.builder().token("BTC").side(Direction.SHORT)
                .quantity(0.01).reduceOnly(true).build());

        assertThat(result.getErrorCode()).isEqualTo("REDUCE_ONLY");
    }

    @Test
    void leverageIsBoundedByVenueMaximum() {
        assertThat(venue.setLeverage("BTC", 0)).isFalse();
        assertThat(venue.setLeverage("BTC", 51)).isFalse();
        assertThat(venue.setLeverage("BTC", 20)).isTrue();
        assertThat(venue.getLeverage("BTC")).isEqualTo(20);
    }

    @Test
    void marketInfoCarriesConfiguredFundingAndNextInterval() {
        MarketInfo info = venue.getMarketInfo("BTC");

        assertThat(info.getFundingRate()).isEqualTo(0.0001);
        assertThat(info.getMaintenanceMarginRate()).isEqualTo(0.005);
        assertThat(info.getNextFundingTime()).isEqualTo(Instant.parse("2026-01-01T08:00:00Z").toEpochMilli());
    }

    private static OrderRequest order(Direction side, double quantity, String externalId) {
        return OrderRequest.builder()
                .token("BTC")
                .side(side)
                .quantity(quantity)
                .externalId(externalId)
                .build();
    }
}
